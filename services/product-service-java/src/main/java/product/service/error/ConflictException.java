package product.service.error;

public class ConflictException extends ProductCreationException {

    public ConflictException(Reason reason) {
        super(reason, reason.getMessage());
    }

    public ConflictException(Reason reason, Throwable cause) {
        super(reason, reason.getMessage(), cause);
    }
}
