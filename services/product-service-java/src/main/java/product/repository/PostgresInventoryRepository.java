package product.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import product.domain.InventoryRecord;

import java.util.List;

@Repository
public class PostgresInventoryRepository implements InventoryRepository {

    private final JdbcTemplate jdbc;

    public PostgresInventoryRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    private static final RowMapper<InventoryRecord> INVENTORY_ROW_MAPPER = (rs, rowNum) -> {
        var r = new InventoryRecord();
        r.setId(rs.getLong("id"));
        r.setProductId(rs.getLong("product_id"));
        r.setWarehouseId(rs.getLong("warehouse_id"));
        r.setQuantity(rs.getInt("quantity"));
        r.setReservedQuantity(rs.getInt("reserved_quantity"));
        return r;
    };

    @Override
    public void insert(InventoryRecord record) {
        jdbc.update("""
                INSERT INTO inventory (warehouse_id, product_id, quantity, reserved_quantity)
                VALUES (?, ?, ?, ?)
                """,
                record.getWarehouseId(),
                record.getProductId(),
                record.getQuantity(),
                record.getReservedQuantity());
    }

    @Override
    public List<InventoryRecord> findByProductId(long productId) {
        return jdbc.query("""
                SELECT id, warehouse_id, product_id, quantity, reserved_quantity
                FROM inventory
                WHERE product_id = ?
                ORDER BY warehouse_id
                """, INVENTORY_ROW_MAPPER, productId);
    }
}
