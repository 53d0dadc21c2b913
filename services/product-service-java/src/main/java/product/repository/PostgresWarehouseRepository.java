package product.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import product.domain.Warehouse;

import java.util.Optional;

@Repository
public class PostgresWarehouseRepository implements WarehouseRepository {

    private final JdbcTemplate jdbc;

    public PostgresWarehouseRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    private static final RowMapper<Warehouse> WAREHOUSE_ROW_MAPPER = (rs, rowNum) -> new Warehouse(
            rs.getLong("id"),
            rs.getLong("company_id"),
            rs.getString("name"),
            rs.getString("address"));

    @Override
    public Optional<Warehouse> findById(long id) {
        var rows = jdbc.query("""
                SELECT id, company_id, name, address
                FROM warehouses
                WHERE id = ?
                """, WAREHOUSE_ROW_MAPPER, id);

        return rows.stream().findFirst();
    }
}
