package product.service.error;

public class InternalErrorException extends ProductCreationException {

    public InternalErrorException(Throwable cause) {
        super(Reason.UNEXPECTED, cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage(),
                cause);
    }
}
