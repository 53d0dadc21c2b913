package product.repository;

import java.util.Optional;

import product.domain.Product;

public interface ProductRepository {
    Optional<Product> findBySku(String normalizedSku);

    Optional<Product> findById(long id);

    /**
     * Inserts the product and returns its generated id. Within a transaction the row stays
     * uncommitted but is visible to later statements of the same transaction.
     */
    long insert(Product product);

    long count();
}
