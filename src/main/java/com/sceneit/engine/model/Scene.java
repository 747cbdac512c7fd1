package com.sceneit.engine.model;

import com.sceneit.engine.api.HasMetadata;
import com.sceneit.engine.api.Id;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A narrative unit with one or more alternate drafts ({@link SceneVariant}s),
 * exactly one of which is active.
 *
 * Scene ordering is not stored here; it lives in the storyboard's scene graph,
 * which refers to scenes by {@link #id()} only.
 */
public final class Scene implements HasMetadata {
    private final Id<Scene> id = Id.random();
    private final List<SceneVariant> variants = new ArrayList<>();
    private Id<SceneVariant> activeVariant;
    private final Metadata metadata = new Metadata();

    /** Creates a scene with a single empty variant, which is active. */
    public Scene() {
        this(new SceneVariant());
    }

    public Scene(SceneVariant initial) {
        Objects.requireNonNull(initial, "initial");
        variants.add(initial);
        activeVariant = initial.id();
    }

    public Id<Scene> id() {
        return id;
    }

    public Id<SceneVariant> activeVariantId() {
        return activeVariant;
    }

    public SceneVariant activeVariant() {
        return variant(activeVariant);
    }

    public List<SceneVariant> variants() {
        return Collections.unmodifiableList(variants);
    }

    /** Adds an alternate draft. The active variant does not change. */
    public void addVariant(SceneVariant variant) {
        Objects.requireNonNull(variant, "variant");
        for (SceneVariant v : variants)
            if (v.id().equals(variant.id()))
                throw new IllegalArgumentException("Duplicate variant: " + variant.id());
        variants.add(variant);
        touch();
    }

    /**
     * Switches the active draft.
     *
     * @throws IllegalArgumentException if the variant does not belong to this scene.
     */
    public void setActiveVariant(Id<SceneVariant> variantId) {
        variant(variantId);
        if (!variantId.equals(activeVariant)) {
            activeVariant = variantId;
            touch();
        }
    }

    private SceneVariant variant(Id<SceneVariant> variantId) {
        for (SceneVariant v : variants)
            if (v.id().equals(variantId))
                return v;
        throw new IllegalArgumentException("Unknown variant " + variantId + " for scene " + id);
    }

    @Override
    public Metadata metadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "Scene[" + id + ", variants=" + variants.size() + ", v" + metadata.getVersion() + "]";
    }
}
