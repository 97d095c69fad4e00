package io.cronrelay.dispatch;

public record PollResult(boolean success, int code, String detail, DispatchFailure failure) {
    static PollResult succeeded(String detail) {
        return new PollResult(true, 200, detail, null);
    }

    static PollResult failed(DispatchFailure failure, String detail) {
        return new PollResult(false, failure.code(), detail, failure);
    }
}
