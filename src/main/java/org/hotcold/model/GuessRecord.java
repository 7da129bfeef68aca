package org.hotcold.model;

import java.math.BigInteger;

public record GuessRecord(String player, String guess, Hint hint, BigInteger buyInPaid, long timestamp) {}
