package com.minishop.productsservice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CategorySummary {
  private String name;
  private long count;
  private String averagePrice; // two decimals, e.g. "79.99"
}
