package product.service;

import product.domain.ProductDraft;
import product.domain.Sku;
import product.service.error.Reason;
import product.service.error.ValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ProductDraftParser {

    public static final String NAME = "name";
    public static final String SKU = "sku";
    public static final String PRICE = "price";
    public static final String WAREHOUSE_ID = "warehouseId";
    public static final String INITIAL_QUANTITY = "initialQuantity";
    public static final String DESCRIPTION = "description";

    // products.unit_price is NUMERIC(12, 2)
    static final int PRICE_SCALE = 2;
    static final int PRICE_INTEGER_DIGITS = 10;

    public static final List<String> REQUIRED_FIELDS = List.of(NAME, SKU, PRICE, WAREHOUSE_ID, INITIAL_QUANTITY);

    private ProductDraftParser() {
    }

    public static ProductDraft parse(Map<String, Object> raw, boolean rejectNegativeQuantity) {
        // A key mapped to null counts as present; its value fails the typed checks below.
        var missing = REQUIRED_FIELDS.stream()
                .filter(f -> !raw.containsKey(f))
                .toList();
        if (!missing.isEmpty())
            throw ValidationException.missingFields(missing);

        var price = parsePrice(raw.get(PRICE));
        var name = requireText(raw.get(NAME), Reason.INVALID_NAME);
        var sku = Sku.normalize(requireText(raw.get(SKU), Reason.INVALID_SKU));
        var quantity = parseQuantity(raw.get(INITIAL_QUANTITY));
        if (rejectNegativeQuantity && quantity < 0)
            throw new ValidationException(Reason.NEGATIVE_QUANTITY);

        var description = raw.get(DESCRIPTION);
        if (description != null && !(description instanceof String))
            throw new ValidationException(Reason.INVALID_DESCRIPTION);
        return new ProductDraft(
                name,
                sku,
                description == null ? "" : ((String) description).strip(),
                price,
                raw.get(WAREHOUSE_ID),
                quantity);
    }

    // Doubles are read through their shortest decimal representation, never their binary value.
    static BigDecimal parsePrice(Object value) {
        BigDecimal price;
        try {
            price = toDecimal(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(Reason.INVALID_PRICE);
        }
        if (price == null)
            throw new ValidationException(Reason.INVALID_PRICE);
        if (price.signum() < 0)
            throw new ValidationException(Reason.NEGATIVE_PRICE);
        var stripped = price.stripTrailingZeros();
        if (stripped.scale() > PRICE_SCALE || stripped.precision() - stripped.scale() > PRICE_INTEGER_DIGITS)
            throw new ValidationException(Reason.INVALID_PRICE);
        return price;
    }

    static int parseQuantity(Object value) {
        try {
            var decimal = toDecimal(value);
            if (decimal == null)
                throw new ValidationException(Reason.INVALID_QUANTITY);
            return decimal.intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ValidationException(Reason.INVALID_QUANTITY);
        }
    }

    static Optional<Long> parseWarehouseId(Object value) {
        try {
            var decimal = toDecimal(value);
            return decimal == null ? Optional.empty() : Optional.of(decimal.longValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    private static String requireText(Object value, Reason reason) {
        if (!(value instanceof String s) || s.isBlank())
            throw new ValidationException(reason);
        return s.strip();
    }

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal d)
            return d;
        if (value instanceof BigInteger i)
            return new BigDecimal(i);
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte)
            return BigDecimal.valueOf(((Number) value).longValue());
        if (value instanceof Double || value instanceof Float)
            return new BigDecimal(value.toString());
        if (value instanceof String s)
            return new BigDecimal(s.strip());
        return null;
    }
}
