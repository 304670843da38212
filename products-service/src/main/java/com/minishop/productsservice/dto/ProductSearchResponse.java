package com.minishop.productsservice.dto;

import com.minishop.productsservice.model.Product;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductSearchResponse {
  private String query;
  private int count;
  private List<Product> products;
}
