package com.tictactoe.client;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * What the console client knows about its game. Written by the network
 * thread, read by the input loop.
 */
public class ClientState {

    private final String username;
    private final AtomicReference<String> gameId = new AtomicReference<>();
    private final AtomicReference<String> symbol = new AtomicReference<>();
    private volatile boolean myTurn;
    private final CountDownLatch finished = new CountDownLatch(1);

    public ClientState(String username) {
        this.username = username;
    }

    public String getUsername() {
        return username;
    }

    public String getGameId() {
        return gameId.get();
    }

    public String getSymbol() {
        return symbol.get();
    }

    void startGame(String gameId, String symbol) {
        this.gameId.set(gameId);
        this.symbol.set(symbol);
        this.myTurn = "X".equals(symbol);
    }

    public boolean isMyTurn() {
        return myTurn;
    }

    void setMyTurn(boolean myTurn) {
        this.myTurn = myTurn;
    }

    public boolean isInGame() {
        return gameId.get() != null && !isFinished();
    }

    void finish() {
        myTurn = false;
        finished.countDown();
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    public boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }
}
