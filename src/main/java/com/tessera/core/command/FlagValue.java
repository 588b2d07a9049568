package com.tessera.core.command;

/**
 * Value of a {@code --flag} token: either a textual value ({@code --model=gpt-4o})
 * or a bare switch ({@code --dry-run}). Tokens that start with {@code --} but carry
 * no name are kept as {@link Malformed} so validation can reject them.
 */
public sealed interface FlagValue permits FlagValue.Text, FlagValue.Switch, FlagValue.Malformed {

    Switch SWITCH = new Switch();

    record Text(String value) implements FlagValue {}

    record Switch() implements FlagValue {}

    record Malformed(String token) implements FlagValue {}
}
