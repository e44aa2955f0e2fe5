package com.sarcodec.sicd;

import com.sarcodec.data.DataField;
import com.sarcodec.data.DataType;
import com.sarcodec.data.ScalarType;
import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import lombok.Getter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * SICD {@code ImageData/PixelType} values and the NITF image subheader values they imply.
 */
@Getter
public enum PixelType {
    RE32F_IM32F(8, "R", "I", "Q", DataType.complex(ScalarType.F4)),
    RE16I_IM16I(4, "SI", "I", "Q", DataType.struct(List.of(
            new DataField("real", DataType.scalar(ScalarType.I2), 0),
            new DataField("imag", DataType.scalar(ScalarType.I2), 2)))),
    AMP8I_PHS8I(2, "INT", "M", "P", DataType.ampPhase());

    private final int bytesPerPixel;
    private final String pvtype;
    private final String firstSubcategory;
    private final String secondSubcategory;
    private final DataType dataType;

    private static final Map<String, PixelType> LOOKUP = new HashMap<>();

    static {
        for (var type : values()) {
            LOOKUP.put(type.name(), type);
        }
    }

    PixelType(int bytesPerPixel, String pvtype, String firstSubcategory, String secondSubcategory, DataType dataType) {
        this.bytesPerPixel = bytesPerPixel;
        this.pvtype = pvtype;
        this.firstSubcategory = firstSubcategory;
        this.secondSubcategory = secondSubcategory;
        this.dataType = dataType;
    }

    /**
     * Bits per band (NBPP/ABPP): each pixel holds two bands.
     */
    public int getBitsPerBand() {
        return bytesPerPixel * 8 / 2;
    }

    public static PixelType fromName(String name) throws SarCodecException {
        var type = LOOKUP.get(name);
        if (type != null) return type;
        throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Unknown SICD PixelType: '" + name + "'");
    }
}
