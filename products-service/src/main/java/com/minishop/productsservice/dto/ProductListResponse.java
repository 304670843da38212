package com.minishop.productsservice.dto;

import com.minishop.productsservice.model.Product;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductListResponse {
  private int count;
  private List<Product> products;

  public static ProductListResponse of(List<Product> products) {
    return new ProductListResponse(products.size(), products);
  }
}
