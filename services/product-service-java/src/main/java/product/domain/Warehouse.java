package product.domain;

public class Warehouse {
  private long id;
  private long companyId;
  private String name;
  private String address;

  public Warehouse() {
  }

  public Warehouse(long id, long companyId, String name, String address) {
    this.id = id;
    this.companyId = companyId;
    this.name = name;
    this.address = address;
  }

  public long getId() {
    return id;
  }

  public long getCompanyId() {
    return companyId;
  }

  public String getName() {
    return name;
  }

  public String getAddress() {
    return address;
  }

  public void setId(long id) {
    this.id = id;
  }

  public void setCompanyId(long companyId) {
    this.companyId = companyId;
  }

  public void setName(String name) {
    this.name = name;
  }

  public void setAddress(String address) {
    this.address = address;
  }
}
