package product.service.error;

public enum Reason {
    MISSING_FIELDS(ErrorKind.VALIDATION, "Missing fields"),
    INVALID_PRICE(ErrorKind.VALIDATION, "Invalid price format"),
    NEGATIVE_PRICE(ErrorKind.VALIDATION, "Price cannot be negative"),
    INVALID_NAME(ErrorKind.VALIDATION, "Name cannot be empty"),
    INVALID_SKU(ErrorKind.VALIDATION, "SKU cannot be empty"),
    INVALID_DESCRIPTION(ErrorKind.VALIDATION, "Description must be a string"),
    INVALID_QUANTITY(ErrorKind.VALIDATION, "Invalid initial quantity"),
    NEGATIVE_QUANTITY(ErrorKind.VALIDATION, "Initial quantity cannot be negative"),
    WAREHOUSE_NOT_FOUND(ErrorKind.NOT_FOUND, "Warehouse not found"),
    SKU_EXISTS(ErrorKind.CONFLICT, "SKU already exists"),
    INTEGRITY_VIOLATION(ErrorKind.CONFLICT, "Database integrity error"),
    UNEXPECTED(ErrorKind.INTERNAL, "Internal error");

    private final ErrorKind kind;
    private final String message;

    Reason(ErrorKind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }
}
