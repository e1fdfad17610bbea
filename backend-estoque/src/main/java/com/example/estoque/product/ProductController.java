package com.example.estoque.product;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/produtos")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;

    private static final String KEY_MENSAGEM = "mensagem";

    @PostMapping
    public ResponseEntity<Product> create(@Valid @RequestBody ProductRequest req) {
        return ResponseEntity.status(201).body(productService.create(req));
    }

    @GetMapping
    public List<Product> list(
            @RequestParam(value = "skip", defaultValue = "0") int skip,
            @RequestParam(value = "limit", defaultValue = "${app.paginacao.limite-padrao:100}") int limit,
            @RequestParam(value = "nome", required = false) String nome,
            @RequestParam(value = "preco_min", required = false) Double precoMin,
            @RequestParam(value = "preco_max", required = false) Double precoMax,
            @RequestParam(value = "estoque_min", required = false) Integer estoqueMin) {
        ProductFilter filtro = ProductFilter.builder()
                .nome(nome)
                .precoMin(precoMin)
                .precoMax(precoMax)
                .estoqueMin(estoqueMin)
                .build();
        return productService.list(skip, limit, filtro);
    }

    @GetMapping("/{id}")
    public Product getById(@PathVariable Long id) {
        return productService.get(id);
    }

    @PutMapping("/{id}")
    public Product update(@PathVariable Long id, @Valid @RequestBody ProductRequest req) {
        return productService.update(id, req);
    }

    @PutMapping("/{id}/estoque")
    public Product updateEstoque(@PathVariable Long id, @Valid @RequestBody StockUpdateRequest req) {
        return productService.updateEstoque(id, req.getQuantidadeEstoque());
    }

    @GetMapping("/{id}/disponibilidade")
    public StockAvailability disponibilidade(@PathVariable Long id,
            @RequestParam("quantidade") int quantidade) {
        return productService.checkAvailability(id, quantidade);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable Long id) {
        productService.delete(id);
        return Map.of(KEY_MENSAGEM, "Produto deletado com sucesso");
    }

    @Data
    public static class StockUpdateRequest {
        @NotNull(message = "Quantidade em estoque é obrigatória")
        @JsonProperty("quantidade_estoque")
        private Integer quantidadeEstoque;
    }
}
