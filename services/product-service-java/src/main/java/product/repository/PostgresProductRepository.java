package product.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import product.domain.Product;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Objects;
import java.util.Optional;

@Repository
public class PostgresProductRepository implements ProductRepository {

    private final JdbcTemplate jdbc;

    public PostgresProductRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    private static final RowMapper<Product> PRODUCT_ROW_MAPPER = new RowMapper<>() {
        @Override
        public Product mapRow(ResultSet rs, int rowNum) throws SQLException {
            var p = new Product();
            p.setId(rs.getLong("id"));
            p.setSku(rs.getString("sku"));
            p.setName(rs.getString("name"));
            p.setDescription(rs.getString("description"));
            p.setPrice(rs.getBigDecimal("unit_price"));

            Timestamp createdAt = rs.getTimestamp("created_at");
            p.setCreatedAt(createdAt == null ? null : createdAt.toInstant());
            return p;
        }
    };

    @Override
    public Optional<Product> findBySku(String normalizedSku) {
        var rows = jdbc.query("""
                SELECT id, sku, name, description, unit_price, created_at
                FROM products
                WHERE sku = ?
                """, PRODUCT_ROW_MAPPER, normalizedSku);

        return rows.stream().findFirst();
    }

    @Override
    public Optional<Product> findById(long id) {
        var rows = jdbc.query("""
                SELECT id, sku, name, description, unit_price, created_at
                FROM products
                WHERE id = ?
                """, PRODUCT_ROW_MAPPER, id);

        return rows.stream().findFirst();
    }

    @Override
    public long insert(Product product) {
        var keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                    INSERT INTO products (sku, name, description, unit_price)
                    VALUES (?, ?, ?, ?)
                    """, new String[] { "id" });
            ps.setString(1, product.getSku());
            ps.setString(2, product.getName());
            ps.setString(3, product.getDescription() == null ? "" : product.getDescription());
            ps.setBigDecimal(4, product.getPrice());
            return ps;
        }, keys);

        long id = Objects.requireNonNull(keys.getKey(), "no generated key for product insert").longValue();
        product.setId(id);
        return id;
    }

    @Override
    public long count() {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM products", Long.class);
        return n == null ? 0 : n;
    }
}
