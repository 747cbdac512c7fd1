package com.sceneit.engine.wiring;

import com.sceneit.engine.api.Id;
import com.sceneit.engine.model.Scene;

/**
 * A mutable structural command carried by the ring buffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every command. Producers fill one in through the {@code setXxx} methods; the
 * consumer reads it and then {@link #clear()}s it.
 *
 * Fields:
 * - type: which storyboard operation to run.
 * - scene / from / dest: operands; unused ones are null.
 * - commandId: caller-assigned correlation id, echoed back in the outcome.
 */
public final class StoryboardCommand {

    public enum Type {
        SET_ROOT,
        LINK,
        UNLINK,
        MOVE,
        DELETE
    }

    private Type type;
    private Id<Scene> scene;
    private Id<Scene> from;
    private Id<Scene> dest;
    private long commandId;

    public void setRoot(Id<Scene> scene, long commandId) {
        set(Type.SET_ROOT, scene, null, null, commandId);
    }

    public void setLink(Id<Scene> from, Id<Scene> dest, long commandId) {
        set(Type.LINK, null, from, dest, commandId);
    }

    public void setUnlink(Id<Scene> from, Id<Scene> dest, long commandId) {
        set(Type.UNLINK, null, from, dest, commandId);
    }

    public void setMove(Id<Scene> scene, Id<Scene> from, Id<Scene> dest, long commandId) {
        set(Type.MOVE, scene, from, dest, commandId);
    }

    public void setDelete(Id<Scene> scene, long commandId) {
        set(Type.DELETE, scene, null, null, commandId);
    }

    private void set(Type type, Id<Scene> scene, Id<Scene> from, Id<Scene> dest, long commandId) {
        this.type = type;
        this.scene = scene;
        this.from = from;
        this.dest = dest;
        this.commandId = commandId;
    }

    public Type type() {
        return type;
    }

    public Id<Scene> scene() {
        return scene;
    }

    public Id<Scene> from() {
        return from;
    }

    public Id<Scene> dest() {
        return dest;
    }

    public long commandId() {
        return commandId;
    }

    public void clear() {
        type = null;
        scene = null;
        from = null;
        dest = null;
        commandId = 0;
    }

    @Override
    public String toString() {
        return "StoryboardCommand[" + commandId + " " + type + " scene=" + scene + " from=" + from + " dest="
                + dest + "]";
    }
}
