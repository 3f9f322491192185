package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Static map obstacle in grid coordinates, optionally carrying a facility.
 * Tile coordinates are origin based (top-left cell).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Obstacle {

    private final String id;
    private final String label;
    private final ObstacleType type;
    private final int tileRow;
    private final int tileCol;
    private final int tileWidth;
    private final int tileHeight;
    private final FacilityInfo facility;

    @JsonCreator
    public Obstacle(@JsonProperty("id") String id,
                    @JsonProperty("label") String label,
                    @JsonProperty("type") ObstacleType type,
                    @JsonProperty("tileRow") int tileRow,
                    @JsonProperty("tileCol") int tileCol,
                    @JsonProperty("tileWidth") int tileWidth,
                    @JsonProperty("tileHeight") int tileHeight,
                    @JsonProperty("facility") FacilityInfo facility) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.label = label;
        this.type = type != null ? type : ObstacleType.BUILDING;
        this.tileRow = tileRow;
        this.tileCol = tileCol;
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        this.facility = facility;
    }

    public String getId() { return id; }
    public String getLabel() { return label; }
    public ObstacleType getType() { return type; }
    public int getTileRow() { return tileRow; }
    public int getTileCol() { return tileCol; }
    public int getTileWidth() { return tileWidth; }
    public int getTileHeight() { return tileHeight; }
    public FacilityInfo getFacility() { return facility; }

    public boolean hasFacility() {
        return facility != null;
    }

    /**
     * Zone interior test. Boundary cells do not count as inside.
     */
    public boolean containsInterior(int row, int col) {
        return row > tileRow && row < tileRow + tileHeight
                && col > tileCol && col < tileCol + tileWidth;
    }

    /**
     * True when the cell lies within {@code proximity} cells of the footprint, footprint included.
     */
    public boolean isNear(int row, int col, int proximity) {
        int minRow = tileRow - proximity;
        int maxRow = tileRow + tileHeight - 1 + proximity;
        int minCol = tileCol - proximity;
        int maxCol = tileCol + tileWidth - 1 + proximity;
        return row >= minRow && row <= maxRow && col >= minCol && col <= maxCol;
    }

    /**
     * True when the cell touches the footprint without being inside it.
     */
    public boolean isAdjacent(int row, int col) {
        if (!isNear(row, col, 1)) {
            return false;
        }
        boolean insideRow = row >= tileRow && row < tileRow + tileHeight;
        boolean insideCol = col >= tileCol && col < tileCol + tileWidth;
        return !(insideRow && insideCol);
    }

    @Override
    public String toString() {
        return String.format("Obstacle{id=%s, type=%s, at=(%d,%d), size=%dx%d, facility=%s}",
                id, type, tileRow, tileCol, tileWidth, tileHeight, facility != null ? facility.tags() : "none");
    }
}
