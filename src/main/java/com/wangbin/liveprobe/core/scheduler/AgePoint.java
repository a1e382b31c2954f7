package com.wangbin.liveprobe.core.scheduler;

import java.time.Instant;

/**
 * 样本时延历史中的一个点
 *
 * @param at    记录时间
 * @param ageMs 当时距最后一个样本的毫秒数，从未收到样本时为null
 */
public record AgePoint(Instant at, Long ageMs) {
}
