package com.work.bond.core.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 测试用时钟：秒级推进。
 */
public class MutableClock extends Clock {

    private volatile long epochSecond;

    public MutableClock(long epochSecond) {
        this.epochSecond = epochSecond;
    }

    public void advance(long seconds) {
        epochSecond += seconds;
    }

    public void set(long epochSecond) {
        this.epochSecond = epochSecond;
    }

    public long now() {
        return epochSecond;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochSecond(epochSecond);
    }
}
