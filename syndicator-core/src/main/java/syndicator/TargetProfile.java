package syndicator;

import syndicator.segment.LengthCounter;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-target limits: text length rule, dispatch concurrency, pacing and daily budget.
 *
 * <p>A target with a daily limit is paced by default: when no explicit {@code minInterval}
 * is configured the spacing is {@code 24h / dailyLimit}, rounded up to the millisecond.
 * Create instances via {@link #builder(String)}.
 */
public final class TargetProfile {
    private static final long DAY_MS = Duration.ofDays(1).toMillis();

    private final String name;
    private final int maxLength;
    private final LengthCounter lengthCounter;
    private final int reserveForCounter;
    private final int concurrency;
    private final Duration minInterval;
    private final int dailyLimit;
    private final String remoteLinkFormat;

    private TargetProfile(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        if (!name.matches("[a-z0-9][a-z0-9_.]*")) {
            throw new IllegalArgumentException("Invalid target name: " + name);
        }
        if (builder.maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be >= 1");
        }
        if (builder.reserveForCounter < 0) {
            throw new IllegalArgumentException("reserveForCounter must be >= 0");
        }
        if (builder.concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        if (builder.dailyLimit < 0) {
            throw new IllegalArgumentException("dailyLimit must be >= 0");
        }
        if (builder.minInterval != null && builder.minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be >= 0");
        }
        this.maxLength = builder.maxLength;
        this.lengthCounter = builder.lengthCounter != null ? builder.lengthCounter : LengthCounter.GRAPHEMES;
        this.reserveForCounter = builder.reserveForCounter;
        this.concurrency = builder.concurrency;
        this.dailyLimit = builder.dailyLimit;
        if (builder.minInterval != null) {
            this.minInterval = builder.minInterval;
        } else if (dailyLimit > 0) {
            this.minInterval = Duration.ofMillis((DAY_MS + dailyLimit - 1) / dailyLimit);
        } else {
            this.minInterval = Duration.ZERO;
        }
        this.remoteLinkFormat = builder.remoteLinkFormat;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public int maxLength() {
        return maxLength;
    }

    public LengthCounter lengthCounter() {
        return lengthCounter;
    }

    public int reserveForCounter() {
        return reserveForCounter;
    }

    public int concurrency() {
        return concurrency;
    }

    public Duration minInterval() {
        return minInterval;
    }

    public int dailyLimit() {
        return dailyLimit;
    }

    public boolean hasDailyLimit() {
        return dailyLimit > 0;
    }

    /**
     * Formats a link to a remote post on this target, or returns {@code null} when the
     * target has no link format configured.
     */
    public String remoteLink(String remoteId) {
        if (remoteLinkFormat == null || remoteId == null) {
            return null;
        }
        return String.format(remoteLinkFormat, remoteId);
    }

    @Override
    public String toString() {
        return "TargetProfile{name=" + name + ", maxLength=" + maxLength
                + ", concurrency=" + concurrency + ", minInterval=" + minInterval
                + ", dailyLimit=" + dailyLimit + "}";
    }

    /** Builder for {@link TargetProfile}. */
    public static final class Builder {
        private final String name;
        private int maxLength = 300;
        private LengthCounter lengthCounter;
        private int reserveForCounter = 6;
        private int concurrency = 4;
        private Duration minInterval;
        private int dailyLimit;
        private String remoteLinkFormat;

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Maximum length of one post, measured by the {@linkplain #lengthCounter counter}.
         *
         * <p>Optional. Defaults to {@code 300}.
         */
        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        /**
         * Length rule of the target.
         *
         * <p>Optional. Defaults to {@link LengthCounter#GRAPHEMES}.
         */
        public Builder lengthCounter(LengthCounter lengthCounter) {
            this.lengthCounter = lengthCounter;
            return this;
        }

        /**
         * Room kept free in each window for the {@code " i/N"} suffix.
         *
         * <p>Optional. Defaults to {@code 6}.
         */
        public Builder reserveForCounter(int reserveForCounter) {
            this.reserveForCounter = reserveForCounter;
            return this;
        }

        /**
         * Number of jobs dispatched in parallel for this target. On a target with a daily limit
         * the budget check, post and count of each attempt still run one at a time.
         *
         * <p>Optional. Defaults to {@code 4}.
         */
        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        /**
         * Minimum spacing between two publisher calls.
         *
         * <p>Optional. Defaults to {@code 24h / dailyLimit} for capped targets, zero otherwise.
         */
        public Builder minInterval(Duration minInterval) {
            this.minInterval = minInterval;
            return this;
        }

        /**
         * Maximum number of posts per UTC day; {@code 0} disables the budget.
         *
         * <p>Optional. Defaults to {@code 0}.
         */
        public Builder dailyLimit(int dailyLimit) {
            this.dailyLimit = dailyLimit;
            return this;
        }

        /**
         * {@link String#format} pattern with a single {@code %s} turning a remote id into a
         * public link, e.g. {@code https://x.com/i/web/status/%s}.
         */
        public Builder remoteLinkFormat(String remoteLinkFormat) {
            this.remoteLinkFormat = remoteLinkFormat;
            return this;
        }

        /**
         * @throws NullPointerException     if {@code name} is null
         * @throws IllegalArgumentException if a limit is out of range
         */
        public TargetProfile build() {
            return new TargetProfile(this);
        }
    }
}
