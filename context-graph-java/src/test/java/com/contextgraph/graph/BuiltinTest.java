package com.contextgraph.graph;

import com.contextgraph.graph.node.Builtin;
import com.contextgraph.graph.node.BuiltinRegistry;
import com.contextgraph.graph.range.Concrete;
import com.contextgraph.graph.range.SolcRange;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinTest {

    @Test
    void parsesElementaryKeywords() {
        assertEquals(Optional.of(new Builtin.Uint(256)), Builtin.tryFromKeyword("uint"));
        assertEquals(Optional.of(new Builtin.Uint(8)), Builtin.tryFromKeyword("uint8"));
        assertEquals(Optional.of(new Builtin.Int(128)), Builtin.tryFromKeyword("int128"));
        assertEquals(Optional.of(new Builtin.Address()), Builtin.tryFromKeyword("address"));
        assertEquals(Optional.of(new Builtin.AddressPayable()), Builtin.tryFromKeyword("address  payable"));
        assertEquals(Optional.of(new Builtin.Bytes(32)), Builtin.tryFromKeyword("bytes32"));
        assertEquals(Optional.of(new Builtin.DynamicBytes()), Builtin.tryFromKeyword("bytes"));
        assertEquals(Optional.of(new Builtin.Bool()), Builtin.tryFromKeyword("bool"));
        assertEquals(Optional.of(new Builtin.StringType()), Builtin.tryFromKeyword("string"));
    }

    @Test
    void rejectsNonElementaryKeywords() {
        assertTrue(Builtin.tryFromKeyword("uint7").isEmpty());
        assertTrue(Builtin.tryFromKeyword("uint264").isEmpty());
        assertTrue(Builtin.tryFromKeyword("bytes33").isEmpty());
        assertTrue(Builtin.tryFromKeyword("MyStruct").isEmpty());
        assertTrue(Builtin.tryFromKeyword(null).isEmpty());
    }

    @Test
    void naturalRangesOfNumericTypes() {
        Loc loc = Loc.of(0, 0, 1);
        SolcRange u8 = new Builtin.Uint(8).naturalRange(loc).orElseThrow();
        assertEquals(BigInteger.ZERO, ((Concrete) u8.min()).value());
        assertEquals(BigInteger.valueOf(255), ((Concrete) u8.max()).value());

        SolcRange i8 = new Builtin.Int(8).naturalRange(loc).orElseThrow();
        assertEquals(BigInteger.valueOf(-128), ((Concrete) i8.min()).value());
        assertEquals(BigInteger.valueOf(127), ((Concrete) i8.max()).value());

        assertTrue(new Builtin.Address().naturalRange(loc).isEmpty());
    }

    @Test
    void registryInternsStructurallyEqualDescriptors() {
        ContextGraph graph = new ContextGraph();
        BuiltinRegistry registry = new BuiltinRegistry();

        NodeIdx a = registry.intern(graph, new Builtin.Uint(256));
        NodeIdx b = registry.intern(graph, Builtin.tryFromKeyword("uint").orElseThrow());
        NodeIdx c = registry.intern(graph, new Builtin.Uint(8));
        NodeIdx arr1 = registry.intern(graph, new Builtin.Array(new Builtin.Uint(8)));
        NodeIdx arr2 = registry.intern(graph, new Builtin.Array(new Builtin.Uint(8)));

        assertEquals(a, b);
        assertNotEquals(a, c);
        assertEquals(arr1, arr2);
        assertEquals(3, registry.size());
        assertEquals(3, graph.nodeCount());
        assertEquals(Optional.of(c), registry.get(new Builtin.Uint(8)));
    }
}
