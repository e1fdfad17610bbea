package com.example.estoque.common;

/**
 * Lançada quando a quantidade pedida de um produto excede o estoque atual.
 */
public class InsufficientStockException extends ConflictException {

    private final Long produtoId;
    private final int disponivel;
    private final int solicitado;

    public InsufficientStockException(Long produtoId, String nomeProduto, int disponivel, int solicitado) {
        super("Estoque insuficiente para o produto " + nomeProduto
                + ". Disponível: " + disponivel + ", Solicitado: " + solicitado);
        this.produtoId = produtoId;
        this.disponivel = disponivel;
        this.solicitado = solicitado;
    }

    public Long getProdutoId() {
        return produtoId;
    }

    public int getDisponivel() {
        return disponivel;
    }

    public int getSolicitado() {
        return solicitado;
    }
}
