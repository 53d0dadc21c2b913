package product.service.error;

public abstract class ProductCreationException extends RuntimeException {

    private final Reason reason;

    protected ProductCreationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected ProductCreationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public ErrorKind getKind() {
        return reason.getKind();
    }
}
