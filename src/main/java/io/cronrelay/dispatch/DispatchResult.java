package io.cronrelay.dispatch;

public record DispatchResult(
        boolean success,
        int responseCode,
        String responseDetail,
        Long childLogId,
        DispatchFailure failure
) {
    public static DispatchResult ok(int code, String detail, Long childLogId) {
        return new DispatchResult(true, code, detail, childLogId, null);
    }

    public static DispatchResult fail(DispatchFailure failure, String detail, Long childLogId) {
        return new DispatchResult(false, failure.code(), detail, childLogId, failure);
    }

    public static DispatchResult httpStatus(int code, String detail, Long childLogId) {
        return new DispatchResult(false, code, detail, childLogId, DispatchFailure.HTTP_STATUS);
    }

    static DispatchResult fromPoll(PollResult poll, long childLogId) {
        return new DispatchResult(poll.success(), poll.code(), poll.detail(), childLogId, poll.failure());
    }
}
