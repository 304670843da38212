package com.minishop.productsservice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductStats {
  private int total;
  private String totalValue;
  private String averagePrice;
  private long totalStock;
  private Map<String, Long> byCategory;
}
