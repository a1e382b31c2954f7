package com.wangbin.liveprobe.core.store;

import com.wangbin.liveprobe.common.domain.entity.Sample;
import com.wangbin.liveprobe.common.domain.entity.SessionInfo;
import com.wangbin.liveprobe.common.domain.enums.ClosureReason;

import java.time.Instant;
import java.util.List;

/**
 * 会话时序存储
 *
 * 每个会话的样本只追加、不修改，序号从0开始连续分配。
 * 写入由该设备的轮询循环单线程完成，读取（跟随/区间）可以并发进行。
 */
public interface TimeSeriesStore {

    // ==================== 写入 ====================

    /**
     * 为设备开启新会话
     *
     * @throws com.wangbin.liveprobe.common.exception.StoreException 设备已有进行中的会话
     */
    SessionInfo openSession(String deviceId, String deviceName, String inputIdentifier, Instant startTime);

    /**
     * 追加样本，由存储分配序号
     *
     * @return 带序号的样本
     * @throws com.wangbin.liveprobe.common.exception.StoreException 会话不存在或已结束
     */
    Sample append(long sessionId, Sample sample);

    /**
     * 结束会话，之后的追加都会失败
     */
    SessionInfo closeSession(long sessionId, Instant endTime, ClosureReason reason);

    // ==================== 读取 ====================

    /**
     * 从指定序号开始跟随会话，会话结束后迭代终止
     */
    SampleTail tail(long sessionId, int fromIndex);

    /**
     * 时间闭区间查询，from/to为null表示不限
     */
    List<Sample> range(long sessionId, Instant from, Instant to);

    /**
     * 序号区间查询 [fromIndex, toIndex)
     */
    List<Sample> rangeByIndex(long sessionId, int fromIndex, int toIndex);

    /**
     * 非阻塞读取一批样本，供HTTP跟随轮询使用
     */
    TailBatch readFrom(long sessionId, int fromIndex, int maxCount);

    /**
     * 会话最后一个样本，没有样本时返回null
     */
    Sample lastSample(long sessionId);

    /**
     * 获取会话信息，不存在时返回null
     */
    SessionInfo getSession(long sessionId);

    /**
     * 设备的全部会话，按会话ID升序
     */
    List<SessionInfo> listSessions(String deviceId);

    List<SessionInfo> listSessions();

    int countOpenSessions();

    // ==================== 管理 ====================

    /**
     * 手动结束会话
     */
    SessionInfo stopSession(long sessionId);

    /**
     * 设置会话标题，空白标题表示清除
     */
    SessionInfo renameSession(long sessionId, String title);

    boolean delete(long sessionId);

    int purgeAll();
}
