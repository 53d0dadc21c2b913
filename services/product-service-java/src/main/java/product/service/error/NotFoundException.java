package product.service.error;

public class NotFoundException extends ProductCreationException {

    public NotFoundException(Reason reason) {
        super(reason, reason.getMessage());
    }
}
