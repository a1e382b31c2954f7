package com.wangbin.liveprobe.core.session;

import com.wangbin.liveprobe.common.domain.enums.ClosureReason;

/**
 * 状态机处理一次轮询结果后的动作
 *
 * @param type           动作类型
 * @param sessionId      相关会话ID，没有时为null
 * @param sequenceIndex  追加样本的序号，未追加时为-1
 * @param reason         关闭原因，仅CLOSED时有值
 */
public record SessionTransition(Type type, Long sessionId, int sequenceIndex, ClosureReason reason) {

    public enum Type {
        /** 开启新会话并写入首个样本 */
        OPENED,
        /** 追加样本 */
        APPENDED,
        /** 直播中轮询失败，尚未达到静默阈值 */
        SILENT,
        /** 会话结束 */
        CLOSED,
        /** 空闲状态下的非直播/失败结果 */
        IGNORED,
        /** 存储拒绝写入，状态机回到空闲 */
        REJECTED
    }

    static SessionTransition of(Type type, Long sessionId) {
        return new SessionTransition(type, sessionId, -1, null);
    }

    static SessionTransition appended(Type type, long sessionId, int sequenceIndex) {
        return new SessionTransition(type, sessionId, sequenceIndex, null);
    }

    static SessionTransition closed(long sessionId, ClosureReason reason) {
        return new SessionTransition(Type.CLOSED, sessionId, -1, reason);
    }

    public boolean isClosed() {
        return type == Type.CLOSED;
    }
}
