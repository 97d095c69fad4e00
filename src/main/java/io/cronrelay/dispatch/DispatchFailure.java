package io.cronrelay.dispatch;

/**
 * Why a dispatch did not succeed, with the response code recorded on the job row.
 * {@link #HTTP_STATUS} carries the endpoint's own code instead.
 */
public enum DispatchFailure {
    MALFORMED_PAYLOAD(400),
    TIMEOUT(408),
    TRANSPORT(500),
    HTTP_STATUS(-1),
    ACCEPTED_WITHOUT_ID(500),
    POLL_QUERY_ERROR(500),
    POLL_FAILED(500),
    POLL_WARNING(200),
    POLL_DEADLINE(408);

    private final int code;

    DispatchFailure(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
