package com.tfbuilder.tfbuilder_backend.graph;

import com.tfbuilder.tfbuilder_backend.model.domain.Block;
import com.tfbuilder.tfbuilder_backend.model.domain.CompositeBlock;
import com.tfbuilder.tfbuilder_backend.model.domain.Connection;
import com.tfbuilder.tfbuilder_backend.model.domain.ConnectionPointType;
import com.tfbuilder.tfbuilder_backend.model.domain.IconTag;
import com.tfbuilder.tfbuilder_backend.model.domain.Point;
import com.tfbuilder.tfbuilder_backend.model.domain.Size;
import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;
import com.tfbuilder.tfbuilder_backend.model.schema.TerraformProperty;
import com.tfbuilder.tfbuilder_backend.schema.SchemaProvider;
import com.tfbuilder.tfbuilder_backend.terraform.reference.TerraformReferenceService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Aggregate root of the canvas: top-level blocks, composites, connections
 * and variables.
 * <p>
 * The graph is either at root scope or inside one composite. Node insertion,
 * grouping and drag matching act on the active scope only. Collections are
 * exposed read-only; all changes go through the operations below.
 * Not thread-safe: callers serialize access.
 */
@Slf4j
public class ResourceGraph {

    /** Maximum distance between a drop point and an anchor for a connection to form. */
    public static final double CONNECTION_THRESHOLD = 30.0;

    private final SchemaProvider schemaProvider;
    private final TerraformReferenceService referenceService;

    private final List<Block> blocks = new ArrayList<>();
    private final List<CompositeBlock> composites = new ArrayList<>();
    private final List<Connection> connections = new ArrayList<>();
    private final VariableState variableState = new VariableState();

    private String currentCompositeId;
    private ConnectionDragState dragState = ConnectionDragState.IDLE;

    public ResourceGraph(SchemaProvider schemaProvider, TerraformReferenceService referenceService) {
        this.schemaProvider = schemaProvider;
        this.referenceService = referenceService;
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    /** Top-level blocks, composite children excluded. */
    public List<Block> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public List<CompositeBlock> getCompositeBlocks() {
        return Collections.unmodifiableList(composites);
    }

    public List<Connection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    public List<TerraformVariable> getVariables() {
        return variableState.getVariables();
    }

    public VariableState getVariableState() {
        return variableState;
    }

    public ConnectionDragState getDragState() {
        return dragState;
    }

    /** Every block in the graph, top-level first, then composite children. */
    public List<Block> getAllBlocks() {
        return Stream.concat(blocks.stream(), composites.stream().flatMap(c -> c.getChildren().stream())).toList();
    }

    /** Blocks of the active scope. */
    public List<Block> getScopedBlocks() {
        return currentComposite().map(CompositeBlock::getChildren).orElseGet(this::getBlocks);
    }

    public Optional<Block> findBlock(String id) {
        return getAllBlocks().stream().filter(b -> b.getId().equals(id)).findFirst();
    }

    public Block getBlock(String id) {
        return findBlock(id).orElseThrow(() -> new NoSuchElementException("Block not found: " + id));
    }

    public Optional<CompositeBlock> findComposite(String id) {
        return composites.stream().filter(c -> c.getId().equals(id)).findFirst();
    }

    public boolean isEmpty() {
        return blocks.isEmpty() && composites.isEmpty();
    }

    // ── Nodes ────────────────────────────────────────────────────────────────

    /**
     * Adds a block to the active scope, filling in schema defaults for
     * properties it does not set yet.
     */
    public Block addNode(Block block) {
        applyDefaults(block);
        return insert(block);
    }

    private void applyDefaults(Block block) {
        for (TerraformProperty property : schemaProvider.getPropertiesForBlock(block)) {
            if (property.hasDefault() && !block.hasProperty(property.name())) {
                block.setProperty(property.name(), property.defaultValue());
            }
        }
    }

    /** Adds a block exactly as given, without schema defaults. Used for parsed and restored blocks. */
    public Block addParsedNode(Block block) {
        return insert(block);
    }

    private Block insert(Block block) {
        if (findBlock(block.getId()).isPresent()) {
            throw new IllegalArgumentException("Block already exists: " + block.getId());
        }
        Optional<CompositeBlock> scope = currentComposite();
        if (scope.isPresent()) {
            scope.get().addChild(block);
        } else {
            blocks.add(block);
        }
        return block;
    }

    /** Removes a block wherever it lives, together with every connection touching it. */
    public boolean removeNode(String id) {
        boolean removed = blocks.removeIf(b -> b.getId().equals(id));
        if (!removed) {
            for (CompositeBlock composite : composites) {
                if (composite.removeChild(id).isPresent()) {
                    removed = true;
                    break;
                }
            }
        }
        if (removed) {
            int before = connections.size();
            connections.removeIf(c -> c.touches(id));
            log.debug("Removed block {} and {} connections", id, before - connections.size());
        }
        return removed;
    }

    public void updatePosition(String id, Point position) {
        getBlock(id).setPosition(position);
    }

    public void updateSize(String id, Size size) {
        getBlock(id).setSize(size);
    }

    public void updateContent(String id, String content) {
        getBlock(id).setContent(content);
    }

    public void updateProperty(String id, String name, String value) {
        getBlock(id).setProperty(name, value);
    }

    public void removeProperty(String id, String name) {
        getBlock(id).removeProperty(name);
    }

    // ── Connections ──────────────────────────────────────────────────────────

    /**
     * Connects two blocks. Self edges, duplicates and unknown ids are rejected
     * by returning empty.
     */
    public Optional<Connection> addConnection(String sourceId, String targetId) {
        if (sourceId.equals(targetId)) return Optional.empty();
        Optional<Block> source = findBlock(sourceId);
        Optional<Block> target = findBlock(targetId);
        if (source.isEmpty() || target.isEmpty()) return Optional.empty();
        if (connections.stream().anyMatch(c -> c.links(sourceId, targetId))) return Optional.empty();
        Connection connection = new Connection(source.get(), target.get());
        connections.add(connection);
        return Optional.of(connection);
    }

    /** Re-creates a stored connection with its id; dangling ids are rejected. */
    public Optional<Connection> restoreConnection(String id, String sourceId, String targetId) {
        Optional<Block> source = findBlock(sourceId);
        Optional<Block> target = findBlock(targetId);
        if (source.isEmpty() || target.isEmpty() || sourceId.equals(targetId)) return Optional.empty();
        if (connections.stream().anyMatch(c -> c.links(sourceId, targetId))) return Optional.empty();
        Connection connection = new Connection(id, source.get(), target.get());
        connections.add(connection);
        return Optional.of(connection);
    }

    public boolean removeConnection(String connectionId) {
        return connections.removeIf(c -> c.getId().equals(connectionId));
    }

    public void startConnectionDrag(String blockId, ConnectionPointType origin) {
        Block block = getBlock(blockId);
        dragState = ConnectionDragState.dragging(blockId, origin, block.getConnectionPointPosition(origin));
    }

    public void updateDragPosition(Point position) {
        dragState = dragState.movedTo(position);
    }

    public void cancelConnectionDrag() {
        dragState = ConnectionDragState.IDLE;
    }

    /**
     * Ends the drag at {@code dropPoint}: finds the nearest anchor of the
     * complementary role on another block of the active scope, strictly
     * within {@link #CONNECTION_THRESHOLD}, and commits the edge. Equal
     * distances resolve to the lowest block id. An OUTPUT origin makes the
     * dragged block the source; an INPUT origin makes it the target.
     */
    public Optional<Connection> endConnectionDrag(Point dropPoint) {
        ConnectionDragState state = dragState;
        dragState = ConnectionDragState.IDLE;
        if (!state.isDragging()) return Optional.empty();

        ConnectionPointType wanted = state.origin().complement();
        Optional<Block> match = getScopedBlocks().stream()
                .filter(b -> !b.getId().equals(state.blockId()))
                .filter(b -> b.getConnectionPointPosition(wanted).distanceTo(dropPoint) < CONNECTION_THRESHOLD)
                .min(Comparator.<Block>comparingDouble(b -> b.getConnectionPointPosition(wanted).distanceTo(dropPoint))
                        .thenComparing(Block::getId));
        if (match.isEmpty()) {
            log.debug("Drag from {} ended with no anchor in range", state.blockId());
            return Optional.empty();
        }
        return state.origin() == ConnectionPointType.OUTPUT
                ? addConnection(state.blockId(), match.get().getId())
                : addConnection(match.get().getId(), state.blockId());
    }

    // ── Composites ───────────────────────────────────────────────────────────

    public CompositeBlock groupNodes(Collection<String> ids, String name) {
        return groupNodes(ids, name, "", IconTag.CATEGORY);
    }

    /**
     * Moves the given top-level blocks into a new composite anchored at their
     * minimum x/y. Children keep ids, properties and positions. Composites do
     * not nest, so grouping is refused while a composite is entered.
     */
    public CompositeBlock groupNodes(Collection<String> ids, String name, String description, IconTag iconTag) {
        if (currentCompositeId != null) {
            throw new IllegalStateException(
                    "Cannot group blocks inside composite " + currentCompositeId + "; exit it first");
        }
        List<Block> grouped = blocks.stream().filter(b -> ids.contains(b.getId())).toList();
        if (grouped.isEmpty()) {
            throw new IllegalArgumentException("No top-level blocks match " + ids);
        }
        double minX = grouped.stream().mapToDouble(b -> b.getPosition().x()).min().orElse(0);
        double minY = grouped.stream().mapToDouble(b -> b.getPosition().y()).min().orElse(0);
        CompositeBlock composite = new CompositeBlock(name, description, iconTag, new Point(minX, minY));
        grouped.forEach(composite::addChild);
        blocks.removeAll(grouped);
        composites.add(composite);
        log.debug("Grouped {} blocks into composite {}", grouped.size(), composite.getId());
        return composite;
    }

    /** Returns the composite's children to the top level and drops the composite. */
    public List<Block> ungroup(String compositeId) {
        CompositeBlock composite = findComposite(compositeId)
                .orElseThrow(() -> new NoSuchElementException("Composite not found: " + compositeId));
        List<Block> children = new ArrayList<>(composite.getChildren());
        children.forEach(child -> composite.removeChild(child.getId()));
        blocks.addAll(children);
        composites.remove(composite);
        if (compositeId.equals(currentCompositeId)) {
            currentCompositeId = null;
        }
        return children;
    }

    /** Adds a template composite; children receive schema defaults like {@link #addNode}. */
    public CompositeBlock addComposite(CompositeBlock composite) {
        composite.getChildren().forEach(this::applyDefaults);
        return addParsedComposite(composite);
    }

    /** Adds a composite exactly as given. Used for restored projects. */
    public CompositeBlock addParsedComposite(CompositeBlock composite) {
        if (findComposite(composite.getId()).isPresent()) {
            throw new IllegalArgumentException("Composite already exists: " + composite.getId());
        }
        composite.getChildren().forEach(child -> {
            if (findBlock(child.getId()).isPresent()) {
                throw new IllegalArgumentException("Block already exists: " + child.getId());
            }
        });
        composites.add(composite);
        return composite;
    }

    /** Deletes a composite and its children, with their connections. */
    public boolean removeComposite(String compositeId) {
        Optional<CompositeBlock> composite = findComposite(compositeId);
        if (composite.isEmpty()) return false;
        composite.get().getChildren().forEach(child -> connections.removeIf(c -> c.touches(child.getId())));
        composites.remove(composite.get());
        if (compositeId.equals(currentCompositeId)) {
            currentCompositeId = null;
        }
        return true;
    }

    public void enterComposite(String compositeId) {
        if (findComposite(compositeId).isEmpty()) {
            throw new NoSuchElementException("Composite not found: " + compositeId);
        }
        currentCompositeId = compositeId;
    }

    public void exitComposite() {
        currentCompositeId = null;
    }

    public Optional<String> getCurrentCompositeId() {
        return Optional.ofNullable(currentCompositeId);
    }

    private Optional<CompositeBlock> currentComposite() {
        return currentCompositeId == null ? Optional.empty() : findComposite(currentCompositeId);
    }

    // ── Variables ────────────────────────────────────────────────────────────

    public boolean addVariable(TerraformVariable variable) {
        return variableState.addVariable(variable);
    }

    public boolean removeVariable(String name) {
        return variableState.removeVariable(name);
    }

    public boolean updateVariable(String name, TerraformVariable replacement) {
        return variableState.updateVariable(name, replacement);
    }

    // ── References ───────────────────────────────────────────────────────────

    /** True when another block's properties reference this block's type and formatted name. */
    public boolean isReferenced(String nodeId) {
        return !referenceService.findReferencesTo(getBlock(nodeId), getAllBlocks()).isEmpty();
    }

    public List<Block> findReferencesTo(String nodeId) {
        return referenceService.findReferencesTo(getBlock(nodeId), getAllBlocks());
    }

    public List<Block> findVariableUsages(String variableName) {
        TerraformVariable variable = variableState.getVariable(variableName)
                .orElseThrow(() -> new NoSuchElementException("Variable not found: " + variableName));
        return referenceService.findReferencesTo(variable, getAllBlocks());
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    public void clear() {
        blocks.clear();
        composites.clear();
        connections.clear();
        variableState.clearAll();
        currentCompositeId = null;
        dragState = ConnectionDragState.IDLE;
    }

    public GraphSnapshot snapshot() {
        return GraphSnapshot.of(getAllBlocks(), connections, variableState.getVariables());
    }
}
