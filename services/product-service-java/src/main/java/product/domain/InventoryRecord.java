package product.domain;

public class InventoryRecord {
  private Long id;
  private long productId;
  private long warehouseId;
  private int quantity;
  private int reservedQuantity;

  public InventoryRecord() {
  }

  public InventoryRecord(long productId, long warehouseId, int quantity) {
    this.productId = productId;
    this.warehouseId = warehouseId;
    this.quantity = quantity;
  }

  public Long getId() {
    return id;
  }

  public long getProductId() {
    return productId;
  }

  public long getWarehouseId() {
    return warehouseId;
  }

  public int getQuantity() {
    return quantity;
  }

  public int getReservedQuantity() {
    return reservedQuantity;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public void setProductId(long productId) {
    this.productId = productId;
  }

  public void setWarehouseId(long warehouseId) {
    this.warehouseId = warehouseId;
  }

  public void setQuantity(int quantity) {
    this.quantity = quantity;
  }

  public void setReservedQuantity(int reservedQuantity) {
    this.reservedQuantity = reservedQuantity;
  }
}
