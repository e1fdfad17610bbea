package com.example.estoque.report;

import com.example.estoque.common.ScopedTransaction;
import com.example.estoque.config.AppProperties;
import com.example.estoque.product.Product;
import com.example.estoque.product.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class ReportService {

    private final JdbcTemplate jdbcTemplate;
    private final ProductRepository productRepository;
    private final ScopedTransaction transaction;
    private final AppProperties appProperties;

    // empate na quantidade vendida: vence o menor id de produto
    private static final String SQL_MAIS_VENDIDO = "SELECT i.produto_id, p.nome, SUM(i.quantidade) AS total_vendido"
            + " FROM itens_pedido i JOIN produtos p ON p.id = i.produto_id"
            + " GROUP BY i.produto_id, p.nome"
            + " ORDER BY total_vendido DESC, i.produto_id ASC"
            + " LIMIT 1";

    public List<Product> getBaixoEstoque(Integer limite) {
        int efetivo = limite != null ? limite : appProperties.getEstoque().getLimiteBaixoEstoque();
        return transaction.readOnly("produtos com baixo estoque", efetivo,
                () -> productRepository.findByQuantidadeEstoqueLessThanEqualOrderByIdAsc(efetivo));
    }

    /**
     * Totais gerais. Todas as consultas rodam na mesma transação somente
     * leitura para que os números sejam coerentes entre si.
     */
    public Map<String, Object> getEstatisticas() {
        return transaction.readOnly("calcular estatísticas", null, () -> {
            Long totalProdutos = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM produtos", Long.class);
            Long totalPedidos = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM pedidos", Long.class);
            Double valorTotal = jdbcTemplate.queryForObject(
                    "SELECT COALESCE(SUM(valor_total),0) FROM pedidos", Double.class);

            long pedidos = totalPedidos != null ? totalPedidos : 0L;
            double valor = valorTotal != null ? valorTotal : 0.0;

            List<Map<String, Object>> maisVendido = jdbcTemplate.query(SQL_MAIS_VENDIDO, (rs, rowNum) -> {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("id", rs.getLong("produto_id"));
                m.put("nome", rs.getString("nome"));
                m.put("quantidade_vendida", rs.getLong("total_vendido"));
                return m;
            });

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("total_produtos", totalProdutos != null ? totalProdutos : 0L);
            result.put("total_pedidos", pedidos);
            result.put("valor_total_pedidos", valor);
            result.put("ticket_medio", pedidos > 0 ? valor / pedidos : 0.0);
            result.put("produto_mais_vendido", maisVendido.isEmpty() ? null : maisVendido.get(0));
            return result;
        });
    }
}
