package product.api.dto;

import product.service.CreatedProduct;

public class CreateProductResponse {
    private String message;
    private long productId;

    public static CreateProductResponse from(CreatedProduct created) {
        var r = new CreateProductResponse();
        r.message = "Product created successfully";
        r.productId = created.getProductId();
        return r;
    }

    public String getMessage() {
        return message;
    }

    public long getProductId() {
        return productId;
    }
}
