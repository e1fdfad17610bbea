package com.example.estoque.report;

import com.example.estoque.product.Product;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reportService;

    @GetMapping("/produtos/baixo-estoque")
    public List<Product> baixoEstoquePadrao() {
        return reportService.getBaixoEstoque(null);
    }

    @GetMapping("/produtos/baixo-estoque/{limite}")
    public List<Product> baixoEstoque(@PathVariable int limite) {
        return reportService.getBaixoEstoque(limite);
    }

    @GetMapping("/estatisticas")
    public Map<String, Object> estatisticas() {
        return reportService.getEstatisticas();
    }
}
