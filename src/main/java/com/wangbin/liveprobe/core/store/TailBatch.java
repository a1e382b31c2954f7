package com.wangbin.liveprobe.core.store;

import com.wangbin.liveprobe.common.domain.entity.Sample;

import java.util.List;

/**
 * 一次跟随读取的结果
 *
 * @param samples   本批样本
 * @param nextIndex 下次读取的起始序号
 * @param closed    会话是否已结束
 */
public record TailBatch(List<Sample> samples, int nextIndex, boolean closed) {
}
