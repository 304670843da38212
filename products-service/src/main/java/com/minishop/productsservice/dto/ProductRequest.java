package com.minishop.productsservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Body of POST and PUT on /products. A {@code null} field was not supplied; on PUT only the
 * non-null fields are written, so {@code ""} and {@code 0} are real updates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {
  private String name;
  private String description;
  private BigDecimal price;
  private String category;
  private Integer stock;
}
