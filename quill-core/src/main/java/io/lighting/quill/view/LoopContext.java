package io.lighting.quill.view;

import io.lighting.quill.value.Value;
import java.util.List;

/**
 * One active {@code foreach}: the item name, a snapshot of the items and the current position.
 */
final class LoopContext {
    private final String itemName;
    private final List<Value> items;
    private int index;

    LoopContext(String itemName, List<Value> items) {
        this.itemName = itemName;
        this.items = List.copyOf(items);
    }

    String itemName() {
        return itemName;
    }

    int index() {
        return index;
    }

    int size() {
        return items.size();
    }

    void moveTo(int position) {
        this.index = position;
    }

    Value current() {
        return index < items.size() ? items.get(index) : Value.NULL;
    }
}
