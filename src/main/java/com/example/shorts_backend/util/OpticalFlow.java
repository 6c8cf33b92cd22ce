package com.example.shorts_backend.util;

import com.example.shorts_backend.engine.Interfaces.MediaSampler.GrayFrame;

/**
 * Dense Lucas-Kanade optical flow between two grayscale frames of equal size. Window sums come
 * from integral images so the cost is linear in the pixel count.
 */
public final class OpticalFlow {

    private static final double MIN_EIGENVALUE = 1.0;
    private static final double MAX_PIXEL_FLOW = 16.0;

    private OpticalFlow() {
    }

    /**
     * Mean flow magnitude in pixels over the frame. Pixels without enough texture to solve the flow
     * count as zero motion.
     *
     * @param radius half window size; the window is {@code 2 * radius + 1} pixels wide.
     */
    public static double meanMagnitude(GrayFrame prev, GrayFrame next, int radius) {
        if (prev.width() != next.width() || prev.height() != next.height()) {
            throw new IllegalArgumentException("Frame sizes differ: " + prev.width() + "x" + prev.height()
                    + " vs " + next.width() + "x" + next.height());
        }
        int w = prev.width();
        int h = prev.height();
        if (w < 2 * radius + 3 || h < 2 * radius + 3) {
            return 0.0;
        }

        int stride = w + 1;
        double[] sxx = new double[stride * (h + 1)];
        double[] sxy = new double[stride * (h + 1)];
        double[] syy = new double[stride * (h + 1)];
        double[] sxt = new double[stride * (h + 1)];
        double[] syt = new double[stride * (h + 1)];

        for (int y = 0; y < h; y++) {
            double rxx = 0, rxy = 0, ryy = 0, rxt = 0, ryt = 0;
            for (int x = 0; x < w; x++) {
                double ix = 0, iy = 0;
                if (x > 0 && x < w - 1 && y > 0 && y < h - 1) {
                    ix = (avg(prev, next, x + 1, y) - avg(prev, next, x - 1, y)) / 2.0;
                    iy = (avg(prev, next, x, y + 1) - avg(prev, next, x, y - 1)) / 2.0;
                }
                double it = next.luma(x, y) - prev.luma(x, y);
                rxx += ix * ix;
                rxy += ix * iy;
                ryy += iy * iy;
                rxt += ix * it;
                ryt += iy * it;
                int idx = (y + 1) * stride + (x + 1);
                int up = y * stride + (x + 1);
                sxx[idx] = sxx[up] + rxx;
                sxy[idx] = sxy[up] + rxy;
                syy[idx] = syy[up] + ryy;
                sxt[idx] = sxt[up] + rxt;
                syt[idx] = syt[up] + ryt;
            }
        }

        double total = 0.0;
        long counted = 0;
        for (int y = radius + 1; y < h - radius - 1; y++) {
            for (int x = radius + 1; x < w - radius - 1; x++) {
                int x0 = x - radius, y0 = y - radius, x1 = x + radius + 1, y1 = y + radius + 1;
                double a = box(sxx, stride, x0, y0, x1, y1);
                double b = box(sxy, stride, x0, y0, x1, y1);
                double c = box(syy, stride, x0, y0, x1, y1);
                double d = box(sxt, stride, x0, y0, x1, y1);
                double e = box(syt, stride, x0, y0, x1, y1);
                counted++;

                double half = (a + c) / 2.0;
                double minEig = half - Math.sqrt(((a - c) / 2.0) * ((a - c) / 2.0) + b * b);
                if (minEig < MIN_EIGENVALUE) {
                    continue;
                }
                double det = a * c - b * b;
                double u = (-c * d + b * e) / det;
                double v = (b * d - a * e) / det;
                total += Math.min(MAX_PIXEL_FLOW, Math.sqrt(u * u + v * v));
            }
        }
        return counted == 0 ? 0.0 : total / counted;
    }

    /**
     * Mean absolute luma difference between two frames, in [0,255].
     */
    public static double meanAbsoluteDifference(GrayFrame prev, GrayFrame next) {
        byte[] a = prev.pixels();
        byte[] b = next.pixels();
        if (a.length != b.length) {
            throw new IllegalArgumentException("Frame sizes differ: " + a.length + " vs " + b.length);
        }
        if (a.length == 0) {
            return 0.0;
        }
        long sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += Math.abs((a[i] & 0xFF) - (b[i] & 0xFF));
        }
        return (double) sum / a.length;
    }

    private static double avg(GrayFrame prev, GrayFrame next, int x, int y) {
        return (prev.luma(x, y) + next.luma(x, y)) / 2.0;
    }

    private static double box(double[] integral, int stride, int x0, int y0, int x1, int y1) {
        return integral[y1 * stride + x1] - integral[y0 * stride + x1] - integral[y1 * stride + x0] + integral[y0 * stride + x0];
    }
}
