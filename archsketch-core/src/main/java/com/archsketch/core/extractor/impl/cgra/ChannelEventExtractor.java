package com.archsketch.core.extractor.impl.cgra;

import com.archsketch.core.extractor.base.AbstractExtractor;
import com.archsketch.core.model.ChannelEvent;
import com.archsketch.core.model.ChannelEventKind;
import com.archsketch.core.model.SyntaxNode;
import com.archsketch.core.walker.TreeWalker;

import java.util.ArrayList;
import java.util.List;

/**
 * Records channel send and receive statements. Events are not paired.
 */
public class ChannelEventExtractor extends AbstractExtractor<ChannelEvent> {

    @Override
    public String getId() {
        return "channel-events";
    }

    @Override
    public String getDisplayName() {
        return "Channel Events";
    }

    @Override
    public List<ChannelEvent> extract(SyntaxNode root) {
        List<ChannelEvent> events = new ArrayList<>();
        TreeWalker.walk(root, node -> {
            ChannelEventKind kind = ChannelEventKind.forNodeKind(node.kind());
            if (kind != null) {
                events.add(new ChannelEvent(kind, node.span()));
            }
        });
        return finish(events);
    }
}
