package com.minishop.productsservice.controller;

import com.minishop.productsservice.dto.CategoryListResponse;
import com.minishop.productsservice.dto.CategorySummary;
import com.minishop.productsservice.dto.ProductListResponse;
import com.minishop.productsservice.dto.ProductRequest;
import com.minishop.productsservice.dto.ProductResponse;
import com.minishop.productsservice.dto.ProductSearchResponse;
import com.minishop.productsservice.dto.ProductStats;
import com.minishop.productsservice.model.Product;
import com.minishop.productsservice.service.ProductService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@RestController
public class ProductController {

  private static final Logger log = LoggerFactory.getLogger(ProductController.class);

  private final ProductService productService;

  @Autowired
  public ProductController(ProductService productService) {
    this.productService = productService;
  }

  // GET /products?category=Accessories&minPrice=20&maxPrice=100&limit=2
  // Unparseable numeric parameters are ignored rather than rejected.
  @GetMapping("/products")
  public ResponseEntity<ProductListResponse> getProducts(
      @RequestParam(required = false) String category,
      @RequestParam(required = false) String minPrice,
      @RequestParam(required = false) String maxPrice,
      @RequestParam(required = false) String limit) {
    List<Product> products =
        productService.getProducts(
            category, parseDecimal(minPrice), parseDecimal(maxPrice), parseLimit(limit));
    return ResponseEntity.ok(ProductListResponse.of(products));
  }

  @GetMapping("/products/{id}")
  public ResponseEntity<Product> getProductById(@PathVariable Long id) {
    log.info("Getting product with id {}", id);
    return ResponseEntity.ok(productService.getProductById(id));
  }

  @GetMapping("/search")
  public ResponseEntity<ProductSearchResponse> searchProducts(
      @RequestParam(required = false) String q) {
    List<Product> results = productService.searchProducts(q);
    return ResponseEntity.ok(new ProductSearchResponse(q, results.size(), results));
  }

  @GetMapping("/categories")
  public ResponseEntity<CategoryListResponse> getCategories() {
    List<CategorySummary> categories = productService.getCategories();
    return ResponseEntity.ok(new CategoryListResponse(categories.size(), categories));
  }

  @PostMapping("/products")
  public ResponseEntity<ProductResponse> createProduct(@RequestBody ProductRequest request) {
    Product createdProduct = productService.createProduct(request);
    return new ResponseEntity<>(
        new ProductResponse("Product created successfully", createdProduct), HttpStatus.CREATED);
  }

  @PutMapping("/products/{id}")
  public ResponseEntity<ProductResponse> updateProduct(
      @PathVariable Long id, @RequestBody(required = false) ProductRequest request) {
    log.info("Updating product with id {}", id);
    Product updatedProduct =
        productService.updateProduct(id, request != null ? request : new ProductRequest());
    return ResponseEntity.ok(new ProductResponse("Product updated successfully", updatedProduct));
  }

  @DeleteMapping("/products/{id}")
  public ResponseEntity<ProductResponse> deleteProduct(@PathVariable Long id) {
    Product deletedProduct = productService.deleteProduct(id);
    return ResponseEntity.ok(new ProductResponse("Product deleted successfully", deletedProduct));
  }

  // PATCH /products/{id}/stock sets an absolute quantity
  // Request Body: {"quantity": 0}
  @PatchMapping("/products/{id}/stock")
  public ResponseEntity<ProductResponse> updateProductStock(
      @PathVariable Long id, @RequestBody(required = false) StockUpdateRequest request) {
    log.info("Updating product stock with id {}, request {}", id, request);
    Integer quantity = request != null ? request.getQuantity() : null;
    Product updatedProduct = productService.updateStock(id, quantity);
    return ResponseEntity.ok(new ProductResponse("Stock updated successfully", updatedProduct));
  }

  @GetMapping("/stats/products")
  public ResponseEntity<ProductStats> getStats() {
    return ResponseEntity.ok(productService.getStats());
  }

  private static BigDecimal parseDecimal(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return new BigDecimal(value.trim());
    } catch (NumberFormatException e) {
      log.debug("Ignoring non-numeric price bound '{}'", value);
      return null;
    }
  }

  private static Integer parseLimit(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      int limit = Integer.parseInt(value.trim());
      return limit >= 0 ? limit : null;
    } catch (NumberFormatException e) {
      log.debug("Ignoring non-numeric limit '{}'", value);
      return null;
    }
  }
}
