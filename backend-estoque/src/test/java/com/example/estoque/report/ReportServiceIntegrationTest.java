package com.example.estoque.report;

import com.example.estoque.order.OrderRequest;
import com.example.estoque.order.OrderService;
import com.example.estoque.product.Product;
import com.example.estoque.product.ProductRequest;
import com.example.estoque.product.ProductService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ReportServiceIntegrationTest {

    @Autowired
    private ReportService reportService;

    @Autowired
    private ProductService productService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setup() {
        jdbcTemplate.update("DELETE FROM itens_pedido");
        jdbcTemplate.update("DELETE FROM pedidos");
        jdbcTemplate.update("DELETE FROM produtos");
    }

    @Test
    void emptyDatabaseHasZeroedStatistics() {
        Map<String, Object> stats = reportService.getEstatisticas();

        assertThat(stats).containsExactly(
                entry("total_produtos", 0L),
                entry("total_pedidos", 0L),
                entry("valor_total_pedidos", 0.0),
                entry("ticket_medio", 0.0),
                entry("produto_mais_vendido", null));
    }

    @Test
    void statisticsSumOrdersAndPickBestSeller() {
        Product a = product("batata", 2.5, 100);
        Product b = product("cebola", 4.0, 100);
        product("alho", 10.0, 100);
        orderService.create(order("Ana", a, 3));
        orderService.create(order("Bruno", b, 5));
        orderService.create(order("Caio", a, 1));

        Map<String, Object> stats = reportService.getEstatisticas();

        assertThat(stats.get("total_produtos")).isEqualTo(3L);
        assertThat(stats.get("total_pedidos")).isEqualTo(3L);
        assertThat(stats.get("valor_total_pedidos")).isEqualTo(30.0);
        assertThat(stats.get("ticket_medio")).isEqualTo(10.0);
        assertThat(stats.get("produto_mais_vendido")).isEqualTo(Map.of(
                "id", b.getId(),
                "nome", "Cebola",
                "quantidade_vendida", 5L));
    }

    @Test
    void bestSellerTieGoesToLowestProductId() {
        Product a = product("tomate", 1.0, 100);
        Product b = product("pepino", 1.0, 100);
        orderService.create(order("Davi", b, 4));
        orderService.create(order("Elis", a, 4));

        @SuppressWarnings("unchecked")
        Map<String, Object> melhor = (Map<String, Object>) reportService.getEstatisticas().get("produto_mais_vendido");

        assertThat(melhor.get("id")).isEqualTo(a.getId());
        assertThat(melhor.get("quantidade_vendida")).isEqualTo(4L);
    }

    @Test
    void bestSellerUsesCurrentCatalogName() {
        Product a = product("melancia", 12.0, 10);
        orderService.create(order("Fabi", a, 2));
        productService.update(a.getId(), ProductRequest.builder()
                .nome("melancia baby").preco(12.0).quantidadeEstoque(8).build());

        @SuppressWarnings("unchecked")
        Map<String, Object> melhor = (Map<String, Object>) reportService.getEstatisticas().get("produto_mais_vendido");

        assertThat(melhor.get("nome")).isEqualTo("Melancia Baby");
    }

    @Test
    void lowStockThresholdIsInclusive() {
        Product zero = product("limao", 0.8, 0);
        Product cinco = product("laranja", 0.9, 5);
        Product dez = product("banana", 0.7, 10);
        product("maca", 1.2, 11);

        assertThat(reportService.getBaixoEstoque(5)).extracting(Product::getId)
                .containsExactly(zero.getId(), cinco.getId());
        assertThat(reportService.getBaixoEstoque(null)).extracting(Product::getId)
                .containsExactly(zero.getId(), cinco.getId(), dez.getId());
        assertThat(reportService.getBaixoEstoque(0)).extracting(Product::getId)
                .containsExactly(zero.getId());
    }

    private Product product(String nome, double preco, int estoque) {
        return productService.create(ProductRequest.builder()
                .nome(nome)
                .preco(preco)
                .quantidadeEstoque(estoque)
                .build());
    }

    private static OrderRequest order(String cliente, Product p, int quantidade) {
        return OrderRequest.builder()
                .cliente(cliente)
                .itens(List.of(new OrderRequest.Item(p.getId(), quantidade)))
                .build();
    }
}
