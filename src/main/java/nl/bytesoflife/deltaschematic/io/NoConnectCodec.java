package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.model.NoConnect;
import nl.bytesoflife.deltaschematic.sexpr.SNode;

public class NoConnectCodec implements ElementCodec<NoConnect> {

    @Override
    public NoConnect read(SNode.SList node) {
        NoConnect noConnect = new NoConnect(Nodes.uuid(node), Nodes.point(Nodes.require(node, "at")), node);
        noConnect.clearModified();
        return noConnect;
    }

    @Override
    public SNode.SList derive(NoConnect noConnect) {
        return NodeBuilder.list("no_connect")
                .at(noConnect.getPosition())
                .field("uuid", noConnect.getUuid())
                .build();
    }
}
