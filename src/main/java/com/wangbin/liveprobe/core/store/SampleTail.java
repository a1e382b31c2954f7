package com.wangbin.liveprobe.core.store;

import com.wangbin.liveprobe.common.domain.entity.Sample;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;

/**
 * 会话跟随迭代器
 *
 * hasNext()在会话进行中会阻塞等待新样本，会话结束或被删除且样本读完后返回false。
 * 每个迭代器只应由一个线程使用。
 */
public class SampleTail implements Iterator<Sample> {

    private final SessionRecord record;
    private int nextIndex;

    SampleTail(SessionRecord record, int fromIndex) {
        this.record = record;
        this.nextIndex = Math.max(0, fromIndex);
    }

    @Override
    public boolean hasNext() {
        if (nextIndex < record.size()) {
            return true;
        }
        try {
            return awaitNext(0L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public Sample next() {
        if (!hasNext()) {
            throw new NoSuchElementException("会话已结束: " + record.getSessionId());
        }
        return record.get(nextIndex++);
    }

    /**
     * 在超时时间内等待下一个样本
     *
     * @return 下一个样本，超时或会话已结束时返回null
     */
    public Sample poll(Duration timeout) throws InterruptedException {
        if (nextIndex < record.size() || awaitNext(Math.max(1L, timeout.toNanos()))) {
            return record.get(nextIndex++);
        }
        return null;
    }

    /**
     * 会话已结束且样本已全部读取
     */
    public boolean isFinished() {
        return (record.isClosed() || record.isRemoved()) && nextIndex >= record.size();
    }

    public int nextIndex() {
        return nextIndex;
    }

    public long sessionId() {
        return record.getSessionId();
    }

    /**
     * @param timeoutNanos 0表示一直等待
     */
    private boolean awaitNext(long timeoutNanos) throws InterruptedException {
        long deadline = System.nanoTime() + timeoutNanos;
        synchronized (record) {
            while (nextIndex >= record.size()) {
                if (record.isClosed() || record.isRemoved()) {
                    return false;
                }
                if (timeoutNanos == 0L) {
                    record.wait();
                } else {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        return false;
                    }
                    TimeUnit.NANOSECONDS.timedWait(record, remaining);
                }
            }
            return true;
        }
    }
}
