package io.github.yok.scq.core.linearalgebra;

import java.util.Map;
import java.util.TreeMap;
import org.ejml.data.DGrowArray;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.IGrowArray;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.sparse.csc.CommonOps_DSCC;

/**
 * 複素行列（演算子）を表す不変クラスです。
 *
 * <p>
 * 実部と虚部を EJML の実行列 2 枚で保持します。保持形式は {@link MatrixType} で、 密行列は {@link DMatrixRMaj}、疎行列は
 * {@link DMatrixSparseCSC} を使います。 形式の異なる行列同士の演算結果は密行列になります。
 * </p>
 */
public final class ComplexMatrix {

    /**
     * 保持形式です。
     */
    private final MatrixType type;

    /**
     * 行数です。
     */
    private final int numRows;

    /**
     * 列数です。
     */
    private final int numCols;

    /**
     * 密行列形式の実部です（疎行列形式では null）。
     */
    private final DMatrixRMaj denseReal;

    /**
     * 密行列形式の虚部です（疎行列形式では null）。
     */
    private final DMatrixRMaj denseImag;

    /**
     * 疎行列形式の実部です（密行列形式では null）。
     */
    private final DMatrixSparseCSC sparseReal;

    /**
     * 疎行列形式の虚部です（密行列形式では null）。
     */
    private final DMatrixSparseCSC sparseImag;

    private ComplexMatrix(DMatrixRMaj real, DMatrixRMaj imag) {
        this.type = MatrixType.DENSE;
        this.numRows = real.numRows;
        this.numCols = real.numCols;
        this.denseReal = real;
        this.denseImag = imag;
        this.sparseReal = null;
        this.sparseImag = null;
    }

    private ComplexMatrix(DMatrixSparseCSC real, DMatrixSparseCSC imag) {
        this.type = MatrixType.SPARSE;
        this.numRows = real.numRows;
        this.numCols = real.numCols;
        this.denseReal = null;
        this.denseImag = null;
        this.sparseReal = real;
        this.sparseImag = imag;
    }

    /**
     * 密行列の実部・虚部から複素行列を生成します（引数はコピーせずに保持します）。
     *
     * @param real 実部です
     * @param imag 虚部です（null の場合はゼロ）
     * @return 複素行列です
     * @throws IllegalArgumentException 形状が一致しない場合に発生します
     */
    public static ComplexMatrix dense(DMatrixRMaj real, DMatrixRMaj imag) {
        if (real == null) {
            throw new IllegalArgumentException("real は null 不可です");
        }
        DMatrixRMaj im = (imag != null) ? imag : new DMatrixRMaj(real.numRows, real.numCols);
        if (im.numRows != real.numRows || im.numCols != real.numCols) {
            throw new IllegalArgumentException("実部と虚部の形状が一致しません");
        }
        return new ComplexMatrix(real, im);
    }

    /**
     * 疎行列の実部・虚部から複素行列を生成します（引数はコピーせずに保持します）。
     *
     * @param real 実部です
     * @param imag 虚部です（null の場合はゼロ）
     * @return 複素行列です
     * @throws IllegalArgumentException 形状が一致しない場合に発生します
     */
    public static ComplexMatrix sparse(DMatrixSparseCSC real, DMatrixSparseCSC imag) {
        if (real == null) {
            throw new IllegalArgumentException("real は null 不可です");
        }
        DMatrixSparseCSC im =
                (imag != null) ? imag : new DMatrixSparseCSC(real.numRows, real.numCols, 0);
        if (im.numRows != real.numRows || im.numCols != real.numCols) {
            throw new IllegalArgumentException("実部と虚部の形状が一致しません");
        }
        return new ComplexMatrix(real, im);
    }

    /**
     * 単位行列を生成します。
     *
     * @param size 次元です（1 以上）
     * @param type 保持形式です
     * @return 単位行列です
     */
    public static ComplexMatrix identity(int size, MatrixType type) {
        if (size <= 0) {
            throw new IllegalArgumentException("size は 1 以上が必要です: " + size);
        }
        double[] ones = new double[size];
        java.util.Arrays.fill(ones, 1.0);
        return diagonal(ones, null, type);
    }

    /**
     * ゼロ行列を生成します。
     *
     * @param numRows 行数です
     * @param numCols 列数です
     * @param type 保持形式です
     * @return ゼロ行列です
     */
    public static ComplexMatrix zeros(int numRows, int numCols, MatrixType type) {
        if (type == MatrixType.DENSE) {
            return new ComplexMatrix(new DMatrixRMaj(numRows, numCols),
                    new DMatrixRMaj(numRows, numCols));
        }
        return new ComplexMatrix(new DMatrixSparseCSC(numRows, numCols, 0),
                new DMatrixSparseCSC(numRows, numCols, 0));
    }

    /**
     * 対角行列を生成します。
     *
     * @param real 対角成分の実部です
     * @param imag 対角成分の虚部です（null の場合はゼロ）
     * @param type 保持形式です
     * @return 対角行列です
     */
    public static ComplexMatrix diagonal(double[] real, double[] imag, MatrixType type) {
        Builder b = builder(real.length, real.length);
        for (int i = 0; i < real.length; i++) {
            b.add(i, i, real[i], (imag != null) ? imag[i] : 0.0);
        }
        return b.build(type);
    }

    /**
     * 要素を 1 つずつ追加して行列を組み立てるビルダーを返します。
     *
     * @param numRows 行数です
     * @param numCols 列数です
     * @return ビルダーです
     */
    public static Builder builder(int numRows, int numCols) {
        return new Builder(numRows, numCols);
    }

    public MatrixType type() {
        return type;
    }

    public int numRows() {
        return numRows;
    }

    public int numCols() {
        return numCols;
    }

    /**
     * 要素の実部を返します。
     *
     * @param row 行です
     * @param col 列です
     * @return 実部です
     */
    public double getReal(int row, int col) {
        return (type == MatrixType.DENSE) ? denseReal.get(row, col) : sparseReal.get(row, col);
    }

    /**
     * 要素の虚部を返します。
     *
     * @param row 行です
     * @param col 列です
     * @return 虚部です
     */
    public double getImag(int row, int col) {
        return (type == MatrixType.DENSE) ? denseImag.get(row, col) : sparseImag.get(row, col);
    }

    /**
     * 和を返します。
     *
     * @param other 加える行列です
     * @return this + other です
     */
    public ComplexMatrix plus(ComplexMatrix other) {
        return linearCombination(1.0, other);
    }

    /**
     * 差を返します。
     *
     * @param other 引く行列です
     * @return this - other です
     */
    public ComplexMatrix minus(ComplexMatrix other) {
        return linearCombination(-1.0, other);
    }

    private ComplexMatrix linearCombination(double beta, ComplexMatrix other) {
        requireSameShape(other);
        if (type == MatrixType.SPARSE && other.type == MatrixType.SPARSE) {
            return new ComplexMatrix(addSparse(sparseReal, beta, other.sparseReal),
                    addSparse(sparseImag, beta, other.sparseImag));
        }
        ComplexMatrix a = toDense();
        ComplexMatrix b = other.toDense();
        DMatrixRMaj re = new DMatrixRMaj(numRows, numCols);
        DMatrixRMaj im = new DMatrixRMaj(numRows, numCols);
        CommonOps_DDRM.add(1.0, a.denseReal, beta, b.denseReal, re);
        CommonOps_DDRM.add(1.0, a.denseImag, beta, b.denseImag, im);
        return new ComplexMatrix(re, im);
    }

    /**
     * 実数倍を返します。
     *
     * @param factor 係数です
     * @return factor * this です
     */
    public ComplexMatrix scale(double factor) {
        return scale(factor, 0.0);
    }

    /**
     * 複素数倍を返します。
     *
     * @param re 係数の実部です
     * @param im 係数の虚部です
     * @return (re + i im) * this です
     */
    public ComplexMatrix scale(double re, double im) {
        if (type == MatrixType.SPARSE) {
            // (re + i im)(A + iB) = (re A - im B) + i (im A + re B)
            return new ComplexMatrix(combineSparse(re, sparseReal, -im, sparseImag),
                    combineSparse(im, sparseReal, re, sparseImag));
        }
        DMatrixRMaj outRe = new DMatrixRMaj(numRows, numCols);
        DMatrixRMaj outIm = new DMatrixRMaj(numRows, numCols);
        CommonOps_DDRM.add(re, denseReal, -im, denseImag, outRe);
        CommonOps_DDRM.add(im, denseReal, re, denseImag, outIm);
        return new ComplexMatrix(outRe, outIm);
    }

    /**
     * 行列積を返します。
     *
     * @param other 右から掛ける行列です
     * @return this * other です
     */
    public ComplexMatrix times(ComplexMatrix other) {
        if (numCols != other.numRows) {
            throw new IllegalArgumentException("行列積の形状が一致しません: " + shape() + " * "
                    + other.shape());
        }
        if (type == MatrixType.SPARSE && other.type == MatrixType.SPARSE) {
            DMatrixSparseCSC rr = multSparse(sparseReal, other.sparseReal);
            DMatrixSparseCSC ii = multSparse(sparseImag, other.sparseImag);
            DMatrixSparseCSC ri = multSparse(sparseReal, other.sparseImag);
            DMatrixSparseCSC ir = multSparse(sparseImag, other.sparseReal);
            return new ComplexMatrix(addSparse(rr, -1.0, ii), addSparse(ri, 1.0, ir));
        }
        ComplexMatrix a = toDense();
        ComplexMatrix b = other.toDense();
        DMatrixRMaj rr = new DMatrixRMaj(numRows, other.numCols);
        DMatrixRMaj ii = new DMatrixRMaj(numRows, other.numCols);
        DMatrixRMaj ri = new DMatrixRMaj(numRows, other.numCols);
        DMatrixRMaj ir = new DMatrixRMaj(numRows, other.numCols);
        CommonOps_DDRM.mult(a.denseReal, b.denseReal, rr);
        CommonOps_DDRM.mult(a.denseImag, b.denseImag, ii);
        CommonOps_DDRM.mult(a.denseReal, b.denseImag, ri);
        CommonOps_DDRM.mult(a.denseImag, b.denseReal, ir);
        DMatrixRMaj re = new DMatrixRMaj(numRows, other.numCols);
        DMatrixRMaj im = new DMatrixRMaj(numRows, other.numCols);
        CommonOps_DDRM.subtract(rr, ii, re);
        CommonOps_DDRM.add(ri, ir, im);
        return new ComplexMatrix(re, im);
    }

    /**
     * 非負整数乗を返します。
     *
     * @param exponent 指数です（0 以上）
     * @return this^exponent です
     */
    public ComplexMatrix power(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("exponent は 0 以上が必要です: " + exponent);
        }
        if (numRows != numCols) {
            throw new IllegalArgumentException("正方行列ではありません: " + shape());
        }
        ComplexMatrix result = identity(numRows, type);
        for (int k = 0; k < exponent; k++) {
            result = result.times(this);
        }
        return result;
    }

    /**
     * クロネッカー積 this ⊗ other を返します。
     *
     * @param other 右側の因子です
     * @return クロネッカー積です
     */
    public ComplexMatrix kron(ComplexMatrix other) {
        if (type == MatrixType.SPARSE && other.type == MatrixType.SPARSE) {
            DMatrixSparseCSC rr = kronSparse(sparseReal, other.sparseReal);
            DMatrixSparseCSC ii = kronSparse(sparseImag, other.sparseImag);
            DMatrixSparseCSC ri = kronSparse(sparseReal, other.sparseImag);
            DMatrixSparseCSC ir = kronSparse(sparseImag, other.sparseReal);
            return new ComplexMatrix(addSparse(rr, -1.0, ii), addSparse(ri, 1.0, ir));
        }
        ComplexMatrix a = toDense();
        ComplexMatrix b = other.toDense();
        int rows = numRows * other.numRows;
        int cols = numCols * other.numCols;
        DMatrixRMaj rr = new DMatrixRMaj(rows, cols);
        DMatrixRMaj ii = new DMatrixRMaj(rows, cols);
        DMatrixRMaj ri = new DMatrixRMaj(rows, cols);
        DMatrixRMaj ir = new DMatrixRMaj(rows, cols);
        CommonOps_DDRM.kron(a.denseReal, b.denseReal, rr);
        CommonOps_DDRM.kron(a.denseImag, b.denseImag, ii);
        CommonOps_DDRM.kron(a.denseReal, b.denseImag, ri);
        CommonOps_DDRM.kron(a.denseImag, b.denseReal, ir);
        DMatrixRMaj re = new DMatrixRMaj(rows, cols);
        DMatrixRMaj im = new DMatrixRMaj(rows, cols);
        CommonOps_DDRM.subtract(rr, ii, re);
        CommonOps_DDRM.add(ri, ir, im);
        return new ComplexMatrix(re, im);
    }

    /**
     * 共役転置（エルミート共役）を返します。
     *
     * @return this† です
     */
    public ComplexMatrix dagger() {
        if (type == MatrixType.SPARSE) {
            DMatrixSparseCSC re = new DMatrixSparseCSC(numCols, numRows, sparseReal.nz_length);
            DMatrixSparseCSC im = new DMatrixSparseCSC(numCols, numRows, sparseImag.nz_length);
            CommonOps_DSCC.transpose(sparseReal, re, new IGrowArray());
            CommonOps_DSCC.transpose(sparseImag, im, new IGrowArray());
            return new ComplexMatrix(re, combineSparse(-1.0, im, 0.0, null));
        }
        DMatrixRMaj re = new DMatrixRMaj(numCols, numRows);
        DMatrixRMaj im = new DMatrixRMaj(numCols, numRows);
        CommonOps_DDRM.transpose(denseReal, re);
        CommonOps_DDRM.transpose(denseImag, im);
        CommonOps_DDRM.scale(-1.0, im);
        return new ComplexMatrix(re, im);
    }

    /**
     * エルミート部分 (A + A†)/2 を返します。
     *
     * @return エルミート部分です
     */
    public ComplexMatrix hermitianPart() {
        return plus(dagger()).scale(0.5);
    }

    /**
     * 密行列形式に変換します（すでに密行列ならそのまま返します）。
     *
     * @return 密行列形式の行列です
     */
    public ComplexMatrix toDense() {
        if (type == MatrixType.DENSE) {
            return this;
        }
        return new ComplexMatrix(sparseToDense(sparseReal), sparseToDense(sparseImag));
    }

    /**
     * 疎行列形式に変換します（すでに疎行列ならそのまま返します）。
     *
     * @return 疎行列形式の行列です
     */
    public ComplexMatrix toSparse() {
        if (type == MatrixType.SPARSE) {
            return this;
        }
        Builder b = builder(numRows, numCols);
        for (int r = 0; r < numRows; r++) {
            for (int c = 0; c < numCols; c++) {
                double re = denseReal.get(r, c);
                double im = denseImag.get(r, c);
                if (re != 0.0 || im != 0.0) {
                    b.add(r, c, re, im);
                }
            }
        }
        return b.build(MatrixType.SPARSE);
    }

    /**
     * 指定形式に変換します。
     *
     * @param target 変換先の形式です
     * @return 変換後の行列です
     */
    public ComplexMatrix as(MatrixType target) {
        return (target == MatrixType.DENSE) ? toDense() : toSparse();
    }

    /**
     * 実部の密行列コピーを返します。
     *
     * @return 実部です
     */
    public DMatrixRMaj realPart() {
        return toDense().denseReal.copy();
    }

    /**
     * 虚部の密行列コピーを返します。
     *
     * @return 虚部です
     */
    public DMatrixRMaj imagPart() {
        return toDense().denseImag.copy();
    }

    /**
     * 虚部の絶対値の最大値を返します。
     *
     * @return 虚部の最大絶対値です
     */
    public double maxAbsImag() {
        if (type == MatrixType.SPARSE) {
            double max = 0.0;
            for (int k = 0; k < sparseImag.nz_length; k++) {
                max = Math.max(max, Math.abs(sparseImag.nz_values[k]));
            }
            return max;
        }
        double max = 0.0;
        for (int k = 0; k < denseImag.getNumElements(); k++) {
            max = Math.max(max, Math.abs(denseImag.data[k]));
        }
        return max;
    }

    /**
     * 他の行列との要素ごとの差（複素絶対値）の最大値を返します。
     *
     * @param other 比較対象です
     * @return 最大差です
     */
    public double maxAbsDifference(ComplexMatrix other) {
        requireSameShape(other);
        ComplexMatrix a = toDense();
        ComplexMatrix b = other.toDense();
        double max = 0.0;
        for (int k = 0; k < a.denseReal.getNumElements(); k++) {
            double dr = a.denseReal.data[k] - b.denseReal.data[k];
            double di = a.denseImag.data[k] - b.denseImag.data[k];
            max = Math.max(max, Math.hypot(dr, di));
        }
        return max;
    }

    /**
     * エルミート性からのずれ max|A - A†| を返します。
     *
     * @return エルミート性からのずれです
     */
    public double hermiticityDefect() {
        return maxAbsDifference(dagger());
    }

    /**
     * 左上の部分行列を返します（固有ベクトルの切り詰め用）。
     *
     * @param rows 行数です
     * @param cols 列数です
     * @return 部分行列（密行列）です
     */
    public ComplexMatrix leadingBlock(int rows, int cols) {
        if (rows > numRows || cols > numCols) {
            throw new IllegalArgumentException(
                    "部分行列が元の行列を超えています: " + rows + "x" + cols + " > " + shape());
        }
        ComplexMatrix a = toDense();
        DMatrixRMaj re = new DMatrixRMaj(rows, cols);
        DMatrixRMaj im = new DMatrixRMaj(rows, cols);
        CommonOps_DDRM.extract(a.denseReal, 0, rows, 0, cols, re, 0, 0);
        CommonOps_DDRM.extract(a.denseImag, 0, rows, 0, cols, im, 0, 0);
        return new ComplexMatrix(re, im);
    }

    /**
     * 形状を "行x列" の文字列で返します。
     *
     * @return 形状文字列です
     */
    public String shape() {
        return numRows + "x" + numCols;
    }

    @Override
    public String toString() {
        return "ComplexMatrix[" + type + ", " + shape() + "]";
    }

    private void requireSameShape(ComplexMatrix other) {
        if (other.numRows != numRows || other.numCols != numCols) {
            throw new IllegalArgumentException("形状が一致しません: " + shape() + " vs " + other.shape());
        }
    }

    private static DMatrixSparseCSC addSparse(DMatrixSparseCSC a, double beta, DMatrixSparseCSC b) {
        DMatrixSparseCSC out = new DMatrixSparseCSC(a.numRows, a.numCols, 0);
        CommonOps_DSCC.add(1.0, a, beta, b, out, new IGrowArray(), new DGrowArray());
        return out;
    }

    private static DMatrixSparseCSC multSparse(DMatrixSparseCSC a, DMatrixSparseCSC b) {
        DMatrixSparseCSC out = new DMatrixSparseCSC(a.numRows, b.numCols, 0);
        CommonOps_DSCC.mult(a, b, out);
        return out;
    }

    /**
     * alpha * a + beta * b を返します（b が null の場合は alpha * a）。
     */
    private static DMatrixSparseCSC combineSparse(double alpha, DMatrixSparseCSC a, double beta,
            DMatrixSparseCSC b) {
        DMatrixSparseCSC scaled = a.copy();
        for (int k = 0; k < scaled.nz_length; k++) {
            scaled.nz_values[k] *= alpha;
        }
        if (b == null || beta == 0.0) {
            return scaled;
        }
        return addSparse(scaled, beta, b);
    }

    /**
     * 疎行列同士のクロネッカー積を CSC 配列へ直接書き込みます。
     */
    private static DMatrixSparseCSC kronSparse(DMatrixSparseCSC a, DMatrixSparseCSC b) {
        int rows = a.numRows * b.numRows;
        int cols = a.numCols * b.numCols;
        int nz = a.nz_length * b.nz_length;
        DMatrixSparseCSC out = new DMatrixSparseCSC(rows, cols, nz);
        int count = 0;
        for (int ca = 0; ca < a.numCols; ca++) {
            for (int cb = 0; cb < b.numCols; cb++) {
                int col = ca * b.numCols + cb;
                for (int ka = a.col_idx[ca]; ka < a.col_idx[ca + 1]; ka++) {
                    int rowOffset = a.nz_rows[ka] * b.numRows;
                    double va = a.nz_values[ka];
                    for (int kb = b.col_idx[cb]; kb < b.col_idx[cb + 1]; kb++) {
                        out.nz_rows[count] = rowOffset + b.nz_rows[kb];
                        out.nz_values[count] = va * b.nz_values[kb];
                        count++;
                    }
                }
                out.col_idx[col + 1] = count;
            }
        }
        out.nz_length = count;
        return out;
    }

    private static DMatrixRMaj sparseToDense(DMatrixSparseCSC s) {
        DMatrixRMaj d = new DMatrixRMaj(s.numRows, s.numCols);
        for (int col = 0; col < s.numCols; col++) {
            for (int k = s.col_idx[col]; k < s.col_idx[col + 1]; k++) {
                d.add(s.nz_rows[k], col, s.nz_values[k]);
            }
        }
        return d;
    }

    /**
     * 要素を追加して {@link ComplexMatrix} を組み立てるビルダーです。
     *
     * <p>
     * 同じ位置への追加は加算されます。
     * </p>
     */
    public static final class Builder {

        private final int numRows;

        private final int numCols;

        /**
         * 列ごとの (行 → {実部, 虚部}) です。
         */
        private final Map<Integer, TreeMap<Integer, double[]>> columns = new TreeMap<>();

        private Builder(int numRows, int numCols) {
            if (numRows <= 0 || numCols <= 0) {
                throw new IllegalArgumentException("行数・列数は 1 以上が必要です: " + numRows + "x" + numCols);
            }
            this.numRows = numRows;
            this.numCols = numCols;
        }

        /**
         * 要素を加算します。
         *
         * @param row 行です
         * @param col 列です
         * @param re 実部です
         * @param im 虚部です
         * @return このビルダーです
         */
        public Builder add(int row, int col, double re, double im) {
            if (row < 0 || row >= numRows || col < 0 || col >= numCols) {
                throw new IndexOutOfBoundsException(
                        "範囲外の要素です: (" + row + ", " + col + ") in " + numRows + "x" + numCols);
            }
            double[] v = columns.computeIfAbsent(col, c -> new TreeMap<>()).computeIfAbsent(row,
                    r -> new double[2]);
            v[0] += re;
            v[1] += im;
            return this;
        }

        /**
         * 行列を生成します。
         *
         * @param type 保持形式です
         * @return 複素行列です
         */
        public ComplexMatrix build(MatrixType type) {
            if (type == MatrixType.DENSE) {
                DMatrixRMaj re = new DMatrixRMaj(numRows, numCols);
                DMatrixRMaj im = new DMatrixRMaj(numRows, numCols);
                columns.forEach((col, rows) -> rows.forEach((row, v) -> {
                    re.set(row, col, v[0]);
                    im.set(row, col, v[1]);
                }));
                return new ComplexMatrix(re, im);
            }
            return new ComplexMatrix(buildPart(0), buildPart(1));
        }

        private DMatrixSparseCSC buildPart(int part) {
            int nz = 0;
            for (TreeMap<Integer, double[]> rows : columns.values()) {
                for (double[] v : rows.values()) {
                    if (v[part] != 0.0) {
                        nz++;
                    }
                }
            }
            DMatrixSparseCSC out = new DMatrixSparseCSC(numRows, numCols, nz);
            int count = 0;
            for (int col = 0; col < numCols; col++) {
                TreeMap<Integer, double[]> rows = columns.get(col);
                if (rows != null) {
                    for (Map.Entry<Integer, double[]> e : rows.entrySet()) {
                        double value = e.getValue()[part];
                        if (value != 0.0) {
                            out.nz_rows[count] = e.getKey();
                            out.nz_values[count] = value;
                            count++;
                        }
                    }
                }
                out.col_idx[col + 1] = count;
            }
            out.nz_length = count;
            out.indicesSorted = true;
            return out;
        }
    }
}
