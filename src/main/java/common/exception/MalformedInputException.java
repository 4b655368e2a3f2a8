package common.exception;

import common.consts.FailureReasonEnum;

import java.util.List;

/**
 * 输入数据不合法 在任何搜索开始之前抛出
 */
public class MalformedInputException extends BusinessException {
    private final List<String> problems;

    public MalformedInputException(String message) {
        this(List.of(message));
    }

    public MalformedInputException(List<String> problems) {
        super(FailureReasonEnum.MALFORMED_INPUT, String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
