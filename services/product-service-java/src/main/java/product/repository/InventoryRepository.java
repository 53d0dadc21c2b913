package product.repository;

import java.util.List;

import product.domain.InventoryRecord;

public interface InventoryRepository {
    void insert(InventoryRecord record);

    List<InventoryRecord> findByProductId(long productId);
}
