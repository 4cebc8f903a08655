package com.contextgraph.graph.node;

import com.contextgraph.graph.Loc;
import com.contextgraph.graph.range.SolcRange;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Elementary types. Implementations are records, so two descriptors of the same type are
 * {@code equals}; {@link BuiltinRegistry} relies on that to keep one node per type.
 */
public interface Builtin extends Node {

    record Uint(int bits) implements Builtin {
        @Override public String label() { return "uint" + bits; }
    }

    record Int(int bits) implements Builtin {
        @Override public String label() { return "int" + bits; }
    }

    record Address() implements Builtin {
        @Override public String label() { return "address"; }
    }

    record AddressPayable() implements Builtin {
        @Override public String label() { return "address payable"; }
    }

    record Bool() implements Builtin {
        @Override public String label() { return "bool"; }
    }

    record StringType() implements Builtin {
        @Override public String label() { return "string"; }
    }

    record Bytes(int size) implements Builtin {
        @Override public String label() { return "bytes" + size; }
    }

    record DynamicBytes() implements Builtin {
        @Override public String label() { return "bytes"; }
    }

    record Array(Builtin inner) implements Builtin {
        @Override public String label() { return inner.label() + "[]"; }
    }

    Uint UINT256 = new Uint(256);
    Int INT256 = new Int(256);

    /**
     * Range every value of this type lies in, for numeric and boolean types.
     */
    default Optional<SolcRange> naturalRange(Loc loc) {
        if (this instanceof Uint) {
            int bits = ((Uint) this).bits();
            return Optional.of(SolcRange.between(BigInteger.ZERO,
                    BigInteger.TWO.pow(bits).subtract(BigInteger.ONE), loc));
        }
        if (this instanceof Int) {
            BigInteger half = BigInteger.TWO.pow(((Int) this).bits() - 1);
            return Optional.of(SolcRange.between(half.negate(), half.subtract(BigInteger.ONE), loc));
        }
        if (this instanceof Bool) {
            return Optional.of(SolcRange.between(BigInteger.ZERO, BigInteger.ONE, loc));
        }
        return Optional.empty();
    }

    /**
     * Parses an elementary type keyword such as {@code uint8}, {@code address payable} or
     * {@code bytes32}. Empty for anything that is not an elementary type.
     */
    static Optional<Builtin> tryFromKeyword(String keyword) {
        if (keyword == null) return Optional.empty();
        String kw = keyword.trim().replaceAll("\\s+", " ");
        switch (kw) {
            case "address":         return Optional.of(new Address());
            case "address payable": return Optional.of(new AddressPayable());
            case "bool":            return Optional.of(new Bool());
            case "string":          return Optional.of(new StringType());
            case "bytes":           return Optional.of(new DynamicBytes());
            case "uint":            return Optional.of(UINT256);
            case "int":             return Optional.of(INT256);
            default:                break;
        }
        if (kw.startsWith("uint")) {
            return intWidth(kw.substring(4)).map(Uint::new);
        }
        if (kw.startsWith("int")) {
            return intWidth(kw.substring(3)).map(Int::new);
        }
        if (kw.startsWith("bytes")) {
            Optional<Integer> size = parseNumber(kw.substring(5));
            if (size.isPresent() && size.get() >= 1 && size.get() <= 32) {
                return Optional.of(new Bytes(size.get()));
            }
        }
        return Optional.empty();
    }

    private static Optional<Integer> intWidth(String digits) {
        return parseNumber(digits).filter(bits -> bits >= 8 && bits <= 256 && bits % 8 == 0);
    }

    private static Optional<Integer> parseNumber(String digits) {
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit) || digits.length() > 3) {
            return Optional.empty();
        }
        return Optional.of(Integer.parseInt(digits));
    }
}
