package com.minishop.productsservice.service;

import com.minishop.productsservice.dto.CategorySummary;
import com.minishop.productsservice.dto.ProductRequest;
import com.minishop.productsservice.dto.ProductStats;
import com.minishop.productsservice.error.ProductNotFoundException;
import com.minishop.productsservice.error.ValidationException;
import com.minishop.productsservice.model.Product;
import com.minishop.productsservice.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class ProductService {

  private static final Logger log = LoggerFactory.getLogger(ProductService.class);

  private final ProductRepository productRepository;

  @Autowired
  public ProductService(ProductRepository productRepository) {
    this.productRepository = productRepository;
  }

  /**
   * Lists products matching every supplied filter. {@code null} arguments are not applied. The
   * category comparison ignores case, the price bounds are inclusive and {@code limit} truncates
   * after filtering.
   */
  public List<Product> getProducts(
      String category, BigDecimal minPrice, BigDecimal maxPrice, Integer limit) {
    Stream<Product> products = productRepository.findAll().stream();
    if (category != null && !category.isEmpty()) {
      products = products.filter(p -> p.getCategory().equalsIgnoreCase(category));
    }
    if (minPrice != null) {
      products = products.filter(p -> p.getPrice().compareTo(minPrice) >= 0);
    }
    if (maxPrice != null) {
      products = products.filter(p -> p.getPrice().compareTo(maxPrice) <= 0);
    }
    if (limit != null && limit >= 0) {
      products = products.limit(limit);
    }
    return products.collect(Collectors.toList());
  }

  public Product getProductById(Long id) {
    return productRepository.findById(id).orElseThrow(() -> new ProductNotFoundException(id));
  }

  public List<Product> searchProducts(String query) {
    if (query == null || query.isBlank()) {
      throw new ValidationException("Search query is required", "/search?q=laptop");
    }
    String term = query.toLowerCase(Locale.ROOT);
    return productRepository.findAll().stream()
        .filter(
            p ->
                contains(p.getName(), term)
                    || contains(p.getDescription(), term)
                    || contains(p.getCategory(), term))
        .collect(Collectors.toList());
  }

  /** One summary per distinct category, in order of first appearance. */
  public List<CategorySummary> getCategories() {
    Map<String, List<Product>> byCategory = groupByCategory(productRepository.findAll());
    List<CategorySummary> summaries = new ArrayList<>(byCategory.size());
    byCategory.forEach(
        (name, products) ->
            summaries.add(
                new CategorySummary(name, products.size(), format(averagePrice(products)))));
    return summaries;
  }

  public Product createProduct(ProductRequest request) {
    if (isBlank(request.getName())
        || request.getPrice() == null
        || isBlank(request.getCategory())) {
      throw new ValidationException("Name, price, and category are required");
    }
    requirePositivePrice(request.getPrice());
    requireNonNegativeStock(request.getStock());

    Product product =
        Product.builder()
            .name(request.getName())
            .description(request.getDescription() != null ? request.getDescription() : "")
            .price(request.getPrice())
            .category(request.getCategory())
            .stock(request.getStock() != null ? request.getStock() : 0)
            .build();
    Product created = productRepository.save(product);
    log.info("Product created with id {}", created.getId());
    return created;
  }

  /** Overwrites every field present in {@code request}; absent fields keep their value. */
  public Product updateProduct(Long id, ProductRequest request) {
    if (productRepository.findById(id).isEmpty()) {
      throw new ProductNotFoundException(id);
    }
    if (request.getName() != null && request.getName().isBlank()) {
      throw new ValidationException("Name must not be empty");
    }
    if (request.getCategory() != null && request.getCategory().isBlank()) {
      throw new ValidationException("Category must not be empty");
    }
    if (request.getPrice() != null) {
      requirePositivePrice(request.getPrice());
    }
    requireNonNegativeStock(request.getStock());

    return productRepository
        .update(
            id,
            existing -> {
              if (request.getName() != null) existing.setName(request.getName());
              if (request.getDescription() != null) {
                existing.setDescription(request.getDescription());
              }
              if (request.getPrice() != null) existing.setPrice(request.getPrice());
              if (request.getCategory() != null) existing.setCategory(request.getCategory());
              if (request.getStock() != null) existing.setStock(request.getStock());
            })
        .orElseThrow(() -> new ProductNotFoundException(id));
  }

  public Product deleteProduct(Long id) {
    Product deleted =
        productRepository.deleteById(id).orElseThrow(() -> new ProductNotFoundException(id));
    log.info("Product {} deleted", id);
    return deleted;
  }

  /** Sets the stock level to {@code quantity}. */
  public Product updateStock(Long productId, Integer quantity) {
    if (productRepository.findById(productId).isEmpty()) {
      throw new ProductNotFoundException(productId);
    }
    if (quantity == null) {
      throw new ValidationException("Quantity is required");
    }
    requireNonNegativeStock(quantity);

    return productRepository
        .update(productId, existing -> existing.setStock(quantity))
        .orElseThrow(() -> new ProductNotFoundException(productId));
  }

  public ProductStats getStats() {
    List<Product> products = productRepository.findAll();
    BigDecimal totalValue =
        products.stream()
            .map(p -> p.getPrice().multiply(BigDecimal.valueOf(p.getStock())))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    long totalStock = products.stream().mapToLong(Product::getStock).sum();

    Map<String, Long> byCategory = new LinkedHashMap<>();
    groupByCategory(products).forEach((name, group) -> byCategory.put(name, (long) group.size()));

    return new ProductStats(
        products.size(),
        format(totalValue),
        format(averagePrice(products)),
        totalStock,
        byCategory);
  }

  public int countProducts() {
    return productRepository.count();
  }

  private static Map<String, List<Product>> groupByCategory(List<Product> products) {
    return products.stream()
        .collect(
            Collectors.groupingBy(Product::getCategory, LinkedHashMap::new, Collectors.toList()));
  }

  private static BigDecimal averagePrice(List<Product> products) {
    if (products.isEmpty()) {
      return BigDecimal.ZERO;
    }
    BigDecimal sum =
        products.stream().map(Product::getPrice).reduce(BigDecimal.ZERO, BigDecimal::add);
    return sum.divide(BigDecimal.valueOf(products.size()), 10, RoundingMode.HALF_UP);
  }

  private static String format(BigDecimal amount) {
    return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }

  private static void requirePositivePrice(BigDecimal price) {
    if (price.signum() <= 0) {
      throw new ValidationException("Price must be greater than 0");
    }
  }

  private static void requireNonNegativeStock(Integer stock) {
    if (stock != null && stock < 0) {
      throw new ValidationException("Stock must not be negative");
    }
  }

  private static boolean contains(String field, String term) {
    return field != null && field.toLowerCase(Locale.ROOT).contains(term);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
