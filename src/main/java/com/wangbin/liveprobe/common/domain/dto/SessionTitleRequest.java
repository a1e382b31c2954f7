package com.wangbin.liveprobe.common.domain.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 会话重命名请求，标题为空表示清除
 */
@Data
public class SessionTitleRequest {

    @Size(max = 200, message = "标题不能超过200个字符")
    private String title;
}
