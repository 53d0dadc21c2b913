package product.service;

public class CreatedProduct {

    private final long productId;

    public CreatedProduct(long productId) {
        this.productId = productId;
    }

    public long getProductId() {
        return productId;
    }
}
