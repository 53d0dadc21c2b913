package product.service.error;

public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    INTERNAL
}
