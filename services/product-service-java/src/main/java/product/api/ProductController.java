package product.api;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import product.api.dto.CreateProductResponse;
import product.service.ProductCreationService;

import java.util.Map;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final ProductCreationService service;

    public ProductController(ProductCreationService service) {
        this.service = service;
    }

    // Untyped body: every missing field is reported at once.
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CreateProductResponse createProduct(@RequestBody Map<String, Object> body) {
        return CreateProductResponse.from(service.createProduct(body));
    }

    @GetMapping("/health")
    public Object health() {
        return Map.of("status", "ok", "service", "product-service");
    }
}
