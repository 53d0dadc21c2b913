package product.domain;

import java.math.BigDecimal;

public class ProductDraft {
  private final String name;
  private final String sku;
  private final String description;
  private final BigDecimal price;
  private final Object warehouseId;
  private final int initialQuantity;

  public ProductDraft(String name, String sku, String description, BigDecimal price, Object warehouseId,
      int initialQuantity) {
    this.name = name;
    this.sku = sku;
    this.description = description;
    this.price = price;
    this.warehouseId = warehouseId;
    this.initialQuantity = initialQuantity;
  }

  public String getName() {
    return name;
  }

  public String getSku() {
    return sku;
  }

  public String getDescription() {
    return description;
  }

  public BigDecimal getPrice() {
    return price;
  }

  public Object getWarehouseId() {
    return warehouseId;
  }

  public int getInitialQuantity() {
    return initialQuantity;
  }

  public Product toProduct() {
    var p = new Product();
    p.setName(name);
    p.setSku(sku);
    p.setDescription(description);
    p.setPrice(price);
    return p;
  }
}
