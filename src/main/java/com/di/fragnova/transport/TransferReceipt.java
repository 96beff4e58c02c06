package com.di.fragnova.transport;

public record TransferReceipt(String fragmentId, String destNode, double latencySeconds) {

    public static TransferReceipt immediate(TransferRequest request) {
        return new TransferReceipt(request.fragmentId(), request.destNode(), 0.0);
    }
}
