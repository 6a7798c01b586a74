package com.work.bond.core.event;

/**
 * 默认实现：丢弃所有事件。
 */
public final class NoopBondEventListener implements BondEventListener {

    public static final NoopBondEventListener INSTANCE = new NoopBondEventListener();

    private NoopBondEventListener() {
    }
}
