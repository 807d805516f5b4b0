package pulse.client;

public class FetchException extends Exception {

    private static final long serialVersionUID = 1L;

    public static final int IO_ERROR = 0;
    public static final int RATE_LIMITED = 429;

    private int code = IO_ERROR;
    private String details = null;

    public FetchException(int code, String message, String details) {
        this(code, message, details, null);
    }

    public FetchException(int code, String message, String details, Throwable error) {
        super(message, error);
        this.code = code;
        this.details = details;
    }

    public int getCode() {
        return code;
    }

    public String getDetails() {
        return details;
    }

    public boolean isRateLimited() {
        return code == RATE_LIMITED;
    }
}
