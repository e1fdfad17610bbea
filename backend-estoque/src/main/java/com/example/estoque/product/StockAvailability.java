package com.example.estoque.product;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class StockAvailability {
    @JsonProperty("produto_id")
    private final Long produtoId;

    @JsonProperty("quantidade_solicitada")
    private final int quantidadeSolicitada;

    @JsonProperty("quantidade_estoque")
    private final int quantidadeEstoque;

    @JsonProperty("disponivel")
    private final boolean disponivel;
}
