package io.surfworks.wavesplit.core.constraint;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.surfworks.wavesplit.core.ConfigurationException;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * Hardware parameters of the target: lanes per wave, waves per workgroup
 * along each grid dimension, and default per-dimension vector widths.
 *
 * <p>Waves per block may be left unset and derived once from the wave
 * constraints during setup.
 */
public final class HardwareConstraint implements Constraint {

    public static final int GRID_RANK = 3;

    private final int threadsPerWave;
    private final Map<IndexSymbol, Integer> vectorShapes;
    private int[] wavesPerBlock;

    public HardwareConstraint(int threadsPerWave, int[] wavesPerBlock, Map<IndexSymbol, Integer> vectorShapes) {
        if (threadsPerWave <= 0) {
            throw new IllegalArgumentException("threadsPerWave must be positive, got " + threadsPerWave);
        }
        this.threadsPerWave = threadsPerWave;
        this.vectorShapes = vectorShapes == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(vectorShapes));
        if (wavesPerBlock != null) {
            setWavesPerBlock(wavesPerBlock);
        }
    }

    public HardwareConstraint(int threadsPerWave, int... wavesPerBlock) {
        this(threadsPerWave, wavesPerBlock.length == 0 ? null : wavesPerBlock, null);
    }

    public int threadsPerWave() {
        return threadsPerWave;
    }

    /**
     * Returns the default vector widths, or null if none were declared.
     */
    public Map<IndexSymbol, Integer> vectorShapes() {
        return vectorShapes;
    }

    public boolean hasWavesPerBlock() {
        return wavesPerBlock != null;
    }

    /**
     * Returns the waves per workgroup along one grid dimension.
     *
     * @throws ConfigurationException if waves per block is not known yet
     */
    public int wavesPerBlock(int workgroupDim) {
        if (wavesPerBlock == null) {
            throw new ConfigurationException("hardware", "waves per block is not known");
        }
        return wavesPerBlock[workgroupDim];
    }

    public int[] wavesPerBlock() {
        return wavesPerBlock == null ? null : wavesPerBlock.clone();
    }

    /**
     * @throws IllegalStateException if waves per block is already set
     */
    public void setWavesPerBlock(int[] wavesPerBlock) {
        if (this.wavesPerBlock != null) {
            throw new IllegalStateException("Waves per block already set to " + Arrays.toString(this.wavesPerBlock));
        }
        if (wavesPerBlock.length != GRID_RANK) {
            throw new IllegalArgumentException("Expected " + GRID_RANK + " waves per block entries, got "
                    + Arrays.toString(wavesPerBlock));
        }
        for (int w : wavesPerBlock) {
            if (w <= 0) {
                throw new IllegalArgumentException("Waves per block must be positive, got "
                        + Arrays.toString(wavesPerBlock));
            }
        }
        this.wavesPerBlock = wavesPerBlock.clone();
    }

    /**
     * Threads per workgroup along each grid dimension. Waves along dimension 0
     * are laid out lane-contiguously.
     */
    public int[] threadsPerBlock() {
        int[] threads = new int[GRID_RANK];
        for (int d = 0; d < GRID_RANK; d++) {
            threads[d] = wavesPerBlock(d) * (d == 0 ? threadsPerWave : 1);
        }
        return threads;
    }

    /**
     * Returns the thread id symbol {@code $T<dim>}.
     */
    public static IndexSymbol threadIdSymbol(int dim) {
        return new IndexSymbol("$T" + dim);
    }

    @Override
    public String toString() {
        return "HardwareConstraint[threadsPerWave=" + threadsPerWave
                + ", wavesPerBlock=" + Arrays.toString(wavesPerBlock)
                + ", vectorShapes=" + vectorShapes + "]";
    }
}
