package product.repository;

import product.domain.InventoryHistoryEntry;

public interface InventoryHistoryRepository {
    void insert(InventoryHistoryEntry entry);

    int countByProductId(long productId);
}
