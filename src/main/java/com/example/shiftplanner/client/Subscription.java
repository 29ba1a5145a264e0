package com.example.shiftplanner.client;

@FunctionalInterface
public interface Subscription {

    void cancel();
}
