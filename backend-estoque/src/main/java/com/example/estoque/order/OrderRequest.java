package com.example.estoque.order;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Corpo de criação e de atualização de pedido.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderRequest {
    @NotBlank(message = "Nome do cliente é obrigatório")
    @Size(max = 100, message = "Nome do cliente deve ter no máximo 100 caracteres")
    @JsonProperty("cliente")
    private String cliente;

    @NotEmpty(message = "Pedido deve conter pelo menos um item")
    @Valid
    @JsonProperty("itens")
    private List<Item> itens;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        @NotNull(message = "ID do produto é obrigatório")
        @Positive(message = "ID do produto deve ser maior que zero")
        @JsonProperty("produto_id")
        private Long produtoId;

        @NotNull(message = "Quantidade é obrigatória")
        @Positive(message = "Quantidade deve ser maior que zero")
        @JsonProperty("quantidade")
        private Integer quantidade;
    }
}
