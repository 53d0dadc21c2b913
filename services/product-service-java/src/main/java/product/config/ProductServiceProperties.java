package product.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "product-service")
public class ProductServiceProperties {

    @Valid
    private Errors errors = new Errors();

    @Valid
    private Inventory inventory = new Inventory();

    public Errors getErrors() {
        return errors;
    }

    public void setErrors(Errors errors) {
        this.errors = errors;
    }

    public Inventory getInventory() {
        return inventory;
    }

    public void setInventory(Inventory inventory) {
        this.inventory = inventory;
    }

    public static class Errors {

        /**
         * Append the exception message to 500 responses. Off in production.
         */
        private boolean exposeInternalMessages = false;

        /**
         * Status for constraint violations raised by storage. 400 keeps existing callers working.
         */
        @Min(400)
        @Max(499)
        private int integrityViolationStatus = 400;

        public boolean isExposeInternalMessages() {
            return exposeInternalMessages;
        }

        public void setExposeInternalMessages(boolean exposeInternalMessages) {
            this.exposeInternalMessages = exposeInternalMessages;
        }

        public int getIntegrityViolationStatus() {
            return integrityViolationStatus;
        }

        public void setIntegrityViolationStatus(int integrityViolationStatus) {
            this.integrityViolationStatus = integrityViolationStatus;
        }
    }

    public static class Inventory {

        private boolean rejectNegativeQuantity = true;

        public boolean isRejectNegativeQuantity() {
            return rejectNegativeQuantity;
        }

        public void setRejectNegativeQuantity(boolean rejectNegativeQuantity) {
            this.rejectNegativeQuantity = rejectNegativeQuantity;
        }
    }
}
