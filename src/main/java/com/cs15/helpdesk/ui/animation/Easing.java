package com.cs15.helpdesk.ui.animation;

/**
 * Interpolation profiles mapping linear progress {@code t} in {@code [0, 1]} to eased progress.
 *
 * <p>Inputs outside the range are clamped, so {@code apply(0) == 0} and {@code apply(1) == 1}
 * for every curve.</p>
 */
public enum Easing {

    LINEAR {
        @Override
        double curve(double t) {
            return t;
        }
    },

    /** Accelerates through the first half and decelerates through the second. */
    IN_OUT_CUBIC {
        @Override
        double curve(double t) {
            if (t < 0.5) {
                return 4 * t * t * t;
            }
            double u = -2 * t + 2;
            return 1 - (u * u * u) / 2;
        }
    };

    abstract double curve(double t);

    /**
     * Returns eased progress for the given linear progress.
     *
     * @param t linear progress; clamped to {@code [0, 1]}
     * @return eased progress in {@code [0, 1]}
     */
    public double apply(double t) {
        if (Double.isNaN(t) || t <= 0) return 0;
        if (t >= 1) return 1;
        return curve(t);
    }
}
