package com.example.jduel.model;

/** Entry of the reaction palette offered to clients. */
public record Reaction(int id, String label) { }
