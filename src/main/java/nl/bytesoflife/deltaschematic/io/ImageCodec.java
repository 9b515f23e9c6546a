package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.NumberStyle;
import nl.bytesoflife.deltaschematic.model.Image;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;

public class ImageCodec implements ElementCodec<Image> {

    static final int DATA_CHUNK = 76;

    @Override
    public Image read(SNode.SList node) {
        StringBuilder data = new StringBuilder();
        node.find("data").ifPresent(list -> {
            for (int i = 1; i < list.size(); i++) {
                data.append(list.text(i));
            }
        });
        Image image = new Image(Nodes.uuid(node), Nodes.point(Nodes.require(node, "at")), data.toString(), node);
        node.find("scale").ifPresent(scale -> image.setScale(SValues.asDouble(scale.get(1))));
        image.clearModified();
        return image;
    }

    @Override
    public SNode.SList derive(Image image) {
        NodeBuilder data = NodeBuilder.list("data");
        String base64 = image.getData();
        for (int i = 0; i < base64.length(); i += DATA_CHUNK) {
            data.string(base64.substring(i, Math.min(base64.length(), i + DATA_CHUNK)));
        }
        NodeBuilder builder = NodeBuilder.list("image").at(image.getPosition());
        if (image.getScale() != 1) {
            builder.child(NodeBuilder.list("scale").number(NumberStyle.COORDINATE, image.getScale()).build());
        }
        return builder.field("uuid", image.getUuid())
                .child(data.build())
                .build();
    }
}
