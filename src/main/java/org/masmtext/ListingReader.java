package org.masmtext;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decodes lifter output from JSON into {@link Listing}s and operand trees.
 * <p>
 * Operand node kinds: {@code add sub mul mem reg ireg int}. Any other kind becomes an
 * {@link Expr.Opaque} node; rendering such an operand fails, reading it does not.
 */
public class ListingReader {
    private static final ObjectMapper OM = new ObjectMapper();

    private final RegisterDictionary registers;

    public ListingReader(RegisterDictionary registers) {
        this.registers = registers;
    }

    public Listing read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            String fallback = file.getFileName().toString().replaceFirst("\\.json$", "");
            return readListing(OM.readTree(in), fallback);
        }
    }

    public Listing readListing(JsonNode root, String fallbackName) {
        if (root == null || !root.isObject())
            throw new IllegalArgumentException("listing must be a JSON object");
        String name = root.path("name").asText(fallbackName);
        Architecture arch = Architecture.parse(root.path("arch").asText("x86"));

        List<Block> blocks = new ArrayList<>();
        if (root.has("blocks")) {
            for (JsonNode b : root.get("blocks")) {
                blocks.add(new Block(b.path("reason").asText(""), b.path("staticData").asBoolean(false),
                        instructions(b.path("instructions"), arch)));
            }
        } else {
            // flat listing: one block
            blocks.add(new Block(instructions(root.path("instructions"), arch)));
        }
        return new Listing(name, arch, blocks);
    }

    private List<Instruction> instructions(JsonNode arr, Architecture arch) {
        if (!arr.isArray())
            throw new IllegalArgumentException("instructions must be an array");
        List<Instruction> list = new ArrayList<>();
        for (JsonNode n : arr) list.add(instruction(n, arch));
        return list;
    }

    public Instruction instruction(JsonNode n, Architecture arch) {
        long address = JsonNumbers.parseUnsigned(n.get("address"), "address");
        JsonNode mnem = n.get("mnemonic");
        if (mnem == null || !mnem.isTextual())
            throw new IllegalArgumentException("instruction at 0x" + Long.toHexString(address) + " has no mnemonic");
        byte[] raw = HexUtils.parseHex(n.path("bytes").asText(""));
        List<Expr> ops = new ArrayList<>();
        for (JsonNode op : n.path("operands")) {
            ops.add(op.isNull() ? null : expr(op));
        }
        return new Instruction(arch, address, mnem.asText(), ops, raw);
    }

    public Expr expr(JsonNode n) {
        if (n == null || !n.isObject())
            throw new IllegalArgumentException("operand must be a JSON object: " + n);
        String kind = n.path("kind").asText("").toLowerCase(Locale.ROOT);
        switch (kind) {
            case "add": return new Expr.Add(child(n, "lhs"), child(n, "rhs"));
            case "sub": return new Expr.Subtract(child(n, "lhs"), child(n, "rhs"));
            case "mul": return new Expr.Multiply(child(n, "lhs"), child(n, "rhs"));
            case "mem": {
                Expr seg = n.hasNonNull("segment") ? expr(n.get("segment")) : null;
                AsmType type = n.hasNonNull("type") ? AsmType.parse(n.get("type").asText()) : null;
                return new Expr.MemoryRef(child(n, "address"), seg, type);
            }
            case "reg": return new Expr.Register(registers.get(n.path("name").asText()));
            case "ireg": {
                if (!n.path("index").canConvertToInt())
                    throw new IllegalArgumentException("ireg needs an integer index: " + n);
                return new Expr.IndirectRegister(n.get("index").asInt());
            }
            case "int": {
                long v = JsonNumbers.parseUnsigned(n.get("value"), "value");
                if (!n.path("bits").canConvertToInt())
                    throw new IllegalArgumentException("int needs bits: " + n);
                return new Expr.IntValue(v, n.get("bits").asInt());
            }
            case "":
                throw new IllegalArgumentException("operand without kind: " + n);
            default:
                return new Expr.Opaque(kind);
        }
    }

    private Expr child(JsonNode n, String field) {
        JsonNode c = n.get(field);
        if (c == null || c.isNull())
            throw new IllegalArgumentException(n.path("kind").asText() + " without " + field);
        return expr(c);
    }
}
