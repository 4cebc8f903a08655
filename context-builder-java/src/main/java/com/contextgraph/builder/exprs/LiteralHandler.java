package com.contextgraph.builder.exprs;

import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.IrException;
import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.Builtin;
import com.contextgraph.graph.node.BuiltinRegistry;
import com.contextgraph.graph.node.ContextVar;
import com.contextgraph.graph.range.SolcRange;

import java.math.BigInteger;

/**
 * Builds constant-range values for literals. Literal nodes are not attached to any scope.
 */
class LiteralHandler {

    /** 10^78 is the smallest power of ten that does not fit in 256 bits. */
    static final int MAX_EXPONENT = 78;
    static final int MAX_BITS = 256;

    private final ContextGraph graph;
    private final BuiltinRegistry builtins;

    LiteralHandler(ContextGraph graph, BuiltinRegistry builtins) {
        this.graph = graph;
        this.builtins = builtins;
    }

    NodeIdx numberLiteral(Loc loc, String value, String exponent) {
        BigInteger number;
        try {
            number = new BigInteger(value.replace("_", ""));
        } catch (NumberFormatException e) {
            throw IrException.unsupported("number literal " + value, loc);
        }
        if (exponent != null && !exponent.isEmpty()) {
            int exp;
            try {
                exp = Integer.parseInt(exponent.replace("_", ""));
            } catch (NumberFormatException e) {
                throw IrException.unsupported("number literal exponent " + exponent, loc);
            }
            number = scale(number, exp, value, loc);
        }
        if (number.bitLength() > MAX_BITS) {
            throw IrException.unsupported("number literal " + value + " wider than " + MAX_BITS + " bits", loc);
        }
        Builtin ty = number.signum() < 0 ? Builtin.INT256 : Builtin.UINT256;
        ContextVar cvar = ContextVar.named(number.toString(), loc, builtins.intern(graph, ty),
                SolcRange.exact(number, loc));
        return graph.addNode(cvar);
    }

    NodeIdx addressLiteral(Loc loc, String address) {
        String hex = address.startsWith("0x") || address.startsWith("0X") ? address.substring(2) : address;
        BigInteger value;
        try {
            value = new BigInteger(hex, 16);
        } catch (NumberFormatException e) {
            throw IrException.unsupported("address literal " + address, loc);
        }
        ContextVar cvar = ContextVar.named(address, loc, builtins.intern(graph, new Builtin.Address()),
                SolcRange.exact(value, loc));
        return graph.addNode(cvar);
    }

    NodeIdx boolLiteral(Loc loc, boolean value) {
        ContextVar cvar = ContextVar.named(Boolean.toString(value), loc, builtins.intern(graph, new Builtin.Bool()),
                SolcRange.exact(value ? BigInteger.ONE : BigInteger.ZERO, loc));
        return graph.addNode(cvar);
    }

    NodeIdx stringLiteral(Loc loc, String text) {
        ContextVar cvar = ContextVar.named("\"" + text + "\"", loc,
                builtins.intern(graph, new Builtin.StringType()), null);
        return graph.addNode(cvar);
    }

    private static BigInteger scale(BigInteger number, int exp, String value, Loc loc) {
        if (exp > MAX_EXPONENT) {
            throw IrException.unsupported("number literal " + value + "e" + exp, loc);
        }
        if (exp >= 0) {
            return number.multiply(BigInteger.TEN.pow(exp));
        }
        if (number.signum() == 0) {
            return number;
        }
        // A divisor with more digits than the value always leaves a remainder.
        if (-(long) exp > number.abs().toString().length()) {
            throw IrException.unsupported("fractional number literal " + value + "e" + exp, loc);
        }
        BigInteger[] qr = number.divideAndRemainder(BigInteger.TEN.pow(-exp));
        if (qr[1].signum() != 0) {
            throw IrException.unsupported("fractional number literal " + value + "e" + exp, loc);
        }
        return qr[0];
    }
}
