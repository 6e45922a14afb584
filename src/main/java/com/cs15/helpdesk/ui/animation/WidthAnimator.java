package com.cs15.helpdesk.ui.animation;

import java.util.Objects;
import java.util.function.IntConsumer;
import java.util.function.LongSupplier;

import javax.swing.Timer;

/**
 * Animates an integer width from a start value to a target value over a fixed duration.
 *
 * <p>Frames are driven by a {@link Timer}, so every width update reaches the sink on the EDT
 * and the UI thread is never blocked. Starting a new animation while one is running stops the
 * old one; callers pass the width currently on screen as the new start value.</p>
 *
 * <p><strong>Threading:</strong> create and call on the EDT.</p>
 */
public final class WidthAnimator {

    /** Roughly 60 frames per second. */
    static final int FRAME_MILLIS = 16;

    private final IntConsumer sink;
    private final int durationMillis;
    private final Easing easing;
    private final LongSupplier clockMillis;
    private final Timer timer;

    private int from;
    private int to;
    private int current;
    private long startedAt;

    /**
     * Creates an animator using the monotonic system clock.
     *
     * @param sink           receives each interpolated width
     * @param durationMillis animation length; {@code 0} applies the target immediately
     * @param easing         interpolation profile
     */
    public WidthAnimator(IntConsumer sink, int durationMillis, Easing easing) {
        this(sink, durationMillis, easing, () -> System.nanoTime() / 1_000_000L);
    }

    WidthAnimator(IntConsumer sink, int durationMillis, Easing easing, LongSupplier clockMillis) {
        if (durationMillis < 0) {
            throw new IllegalArgumentException("durationMillis must not be negative: " + durationMillis);
        }
        this.sink = Objects.requireNonNull(sink, "sink");
        this.durationMillis = durationMillis;
        this.easing = Objects.requireNonNull(easing, "easing");
        this.clockMillis = Objects.requireNonNull(clockMillis, "clockMillis");
        this.timer = new Timer(FRAME_MILLIS, e -> tick());
        this.timer.setInitialDelay(0);
    }

    /**
     * Starts animating from {@code fromWidth} to {@code toWidth}, replacing any running animation.
     *
     * @param fromWidth width currently shown
     * @param toWidth   width to settle on
     */
    public void animate(int fromWidth, int toWidth) {
        timer.stop();
        this.from = fromWidth;
        this.to = toWidth;
        this.startedAt = clockMillis.getAsLong();
        if (durationMillis == 0 || fromWidth == toWidth) {
            apply(toWidth);
            return;
        }
        apply(fromWidth);
        timer.start();
    }

    /** Jumps to the target width and stops the timer. No-op when idle. */
    public void finish() {
        if (!timer.isRunning()) {
            return;
        }
        timer.stop();
        apply(to);
    }

    /** True while frames are still being scheduled. */
    public boolean isRunning() {
        return timer.isRunning();
    }

    /** Width most recently handed to the sink. */
    public int currentWidth() {
        return current;
    }

    /** Width the current (or last) animation settles on. */
    public int targetWidth() {
        return to;
    }

    /** Advances one frame according to the clock; stops once the duration has elapsed. */
    void tick() {
        long elapsed = clockMillis.getAsLong() - startedAt;
        if (elapsed >= durationMillis) {
            timer.stop();
            apply(to);
            return;
        }
        apply(widthAt(elapsed));
    }

    /**
     * Interpolated width after {@code elapsedMillis} of the current animation.
     *
     * @param elapsedMillis time since {@link #animate(int, int)}
     * @return eased width between the start and target values
     */
    int widthAt(long elapsedMillis) {
        double t = durationMillis == 0 ? 1.0 : (double) elapsedMillis / durationMillis;
        return (int) Math.round(from + (to - from) * easing.apply(t));
    }

    private void apply(int width) {
        current = width;
        sink.accept(width);
    }
}
