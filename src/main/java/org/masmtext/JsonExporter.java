package org.masmtext;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Rendered listing as JSON: one node per instruction with address, hex bytes, mnemonic and
 * operand text (or the error that stopped rendering it).
 */
public class JsonExporter {

    public static ObjectNode toJson(ObjectMapper om, Listing listing, List<InstructionInfo> rendered) {
        ObjectNode root = om.createObjectNode();
        root.put("name", listing.name);
        root.put("arch", listing.arch.name().toLowerCase(java.util.Locale.ROOT));

        ArrayNode nodes = om.createArrayNode();
        for (InstructionInfo info : rendered) {
            ObjectNode n = om.createObjectNode();
            n.put("address", String.format("0x%X", info.address));
            n.put("hex", info.hexBytes);
            n.put("mnemonic", info.mnemonic);
            if (info.failed()) {
                n.put("error", info.error);
            } else {
                n.put("operands", info.operands);
                n.put("line", info.line);
            }
            nodes.add(n);
        }
        root.set("instructions", nodes);
        return root;
    }

    public static void export(Listing listing, List<InstructionInfo> rendered, Path out) throws IOException {
        ObjectMapper om = new ObjectMapper();
        om.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), toJson(om, listing, rendered));
    }
}
