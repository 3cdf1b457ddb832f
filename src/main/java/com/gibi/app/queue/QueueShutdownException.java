package com.gibi.app.queue;

/** Lançada por {@link ScanQueue#dequeue()} depois do shutdown: sinal para o worker sair. */
public class QueueShutdownException extends RuntimeException {

    public QueueShutdownException() {
        super("Fila de scan encerrada");
    }
}
