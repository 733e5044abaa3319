package io.github.riemr.assign.optimization;

/**
 * 最適化の入力が不正（SOP または候補者が 0 件）な場合に送出する。部分結果は返さない。
 */
public class InvalidAssignmentInputException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public InvalidAssignmentInputException(String message) {
        super(message);
    }
}
