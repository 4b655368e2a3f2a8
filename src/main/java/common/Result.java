package common;

import common.consts.FailureReasonEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 响应结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Result {
    private Integer code;   // 200成功 其余见 FailureReasonEnum
    private String reason;  // 失败原因标签 成功时为空
    private String msg;     // 消息
    private Object data;    // 数据

    // 成功 (无数据)
    public static Result success() {
        return new Result(200, null, "操作成功", null);
    }

    // 成功 (带数据)
    public static Result success(Object data) {
        return new Result(200, null, "操作成功", data);
    }

    // 成功 (带消息和数据)
    public static Result success(String msg, Object data) {
        return new Result(200, null, msg, data);
    }

    // 带标签的失败 (如不可行/约束未满足) 仍可携带数据供调用方参考
    public static Result failure(FailureReasonEnum reason, String msg, Object data) {
        return new Result(reason.getCode(), reason.name(), msg, data);
    }

    // 失败 (默认 500 状态码)
    public static Result error(String msg) {
        return new Result(500, null, msg, null);
    }
}
