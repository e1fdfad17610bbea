package com.example.estoque.product;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

/**
 * Filtros opcionais da listagem de produtos. Campos nulos não restringem.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProductFilter {
    private String nome;
    private Double precoMin;
    private Double precoMax;
    private Integer estoqueMin;

    public static ProductFilter empty() {
        return new ProductFilter();
    }

    Specification<Product> toSpecification() {
        Specification<Product> spec = (root, query, cb) -> cb.conjunction();
        if (StringUtils.hasText(nome)) {
            String termo = "%" + nome.strip().toLowerCase() + "%";
            spec = spec.and((root, query, cb) -> cb.like(cb.lower(root.get("nome")), termo));
        }
        if (precoMin != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("preco"), precoMin));
        }
        if (precoMax != null) {
            spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.get("preco"), precoMax));
        }
        if (estoqueMin != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("quantidadeEstoque"), estoqueMin));
        }
        return spec;
    }
}
