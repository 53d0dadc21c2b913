package product.service.error;

import java.util.List;

public class ValidationException extends ProductCreationException {

    private final List<String> missingFields;

    public ValidationException(Reason reason) {
        super(reason, reason.getMessage());
        this.missingFields = List.of();
    }

    private ValidationException(List<String> missingFields) {
        super(Reason.MISSING_FIELDS, Reason.MISSING_FIELDS.getMessage() + ": " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public static ValidationException missingFields(List<String> fields) {
        return new ValidationException(fields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
