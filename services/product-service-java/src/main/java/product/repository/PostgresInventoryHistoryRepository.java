package product.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import product.domain.InventoryHistoryEntry;

@Repository
public class PostgresInventoryHistoryRepository implements InventoryHistoryRepository {

    private final JdbcTemplate jdbc;

    public PostgresInventoryHistoryRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void insert(InventoryHistoryEntry entry) {
        jdbc.update("""
                INSERT INTO inventory_history (warehouse_id, product_id, change_type, quantity_before,
                    quantity_change, quantity_after, reference_type, reference_id, notes)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                entry.getWarehouseId(),
                entry.getProductId(),
                entry.getChangeType().name(),
                entry.getQuantityBefore(),
                entry.getQuantityChange(),
                entry.getQuantityAfter(),
                entry.getReferenceType(),
                entry.getReferenceId(),
                entry.getNotes());
    }

    @Override
    public int countByProductId(long productId) {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM inventory_history WHERE product_id = ?", Integer.class, productId);
        return n == null ? 0 : n;
    }
}
