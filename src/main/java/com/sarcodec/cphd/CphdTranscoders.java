package com.sarcodec.cphd;

import com.sarcodec.xml.ElementPath;
import com.sarcodec.xml.ImageCornersTranscoder;
import com.sarcodec.xml.ListTranscoder;
import com.sarcodec.xml.SequenceTranscoder;
import com.sarcodec.xml.Transcoder;
import com.sarcodec.xml.TranscoderRegistry;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.sarcodec.xml.Transcoder.BOOL;
import static com.sarcodec.xml.Transcoder.DBL;
import static com.sarcodec.xml.Transcoder.HEX;
import static com.sarcodec.xml.Transcoder.INT;
import static com.sarcodec.xml.Transcoder.LAT_LON;
import static com.sarcodec.xml.Transcoder.LAT_LON_HAE;
import static com.sarcodec.xml.Transcoder.LINE_SAMP;
import static com.sarcodec.xml.Transcoder.PARAMETER;
import static com.sarcodec.xml.Transcoder.POLY;
import static com.sarcodec.xml.Transcoder.POLY2D;
import static com.sarcodec.xml.Transcoder.TXT;
import static com.sarcodec.xml.Transcoder.XDT;
import static com.sarcodec.xml.Transcoder.XY;
import static com.sarcodec.xml.Transcoder.XYZ;
import static com.sarcodec.xml.Transcoder.XYZ_POLY;

/**
 * Transcoder table for CPHD XML, namespace-wildcarded across CPHD versions.
 */
@UtilityClass
public class CphdTranscoders {

    /**
     * Four {@code IACP} corners indexed 1 to 4.
     */
    public final Transcoder<double[][]> IMAGE_AREA_CORNER_POINTS =
            new ImageCornersTranscoder("IACP", List.of("1", "2", "3", "4"));

    /**
     * A PVP parameter declaration: word offset, size in words and binary format.
     */
    public final Transcoder<Map<String, Object>> PVP = new SequenceTranscoder(pvpMembers(false));

    public final Transcoder<Map<String, Object>> ADDED_PVP = new SequenceTranscoder(pvpMembers(true));

    public TranscoderRegistry create() {
        var registry = new TranscoderRegistry().collapse("GeoInfo");
        table().forEach((path, transcoder) -> registry.register(ElementPath.wildcard(path), transcoder));
        return registry;
    }

    public Map<String, Transcoder<?>> table() {
        var t = new LinkedHashMap<String, Transcoder<?>>();

        for (var name : new String[]{"CollectorName", "IlluminatorName", "CoreName", "CollectType", "Classification",
                "ReleaseInfo", "CountryCode"}) {
            t.put("CollectionID/" + name, TXT);
        }
        t.put("CollectionID/RadarMode/ModeType", Transcoder.token("SPOTLIGHT", "STRIPMAP", "DYNAMIC STRIPMAP"));
        t.put("CollectionID/RadarMode/ModeID", TXT);
        t.put("CollectionID/Parameter", PARAMETER);

        t.put("Global/DomainType", Transcoder.token("FX", "TOA"));
        t.put("Global/SGN", INT);
        t.put("Global/Timeline/CollectionStart", XDT);
        t.put("Global/Timeline/RcvCollectionStart", XDT);
        t.put("Global/Timeline/TxTime1", DBL);
        t.put("Global/Timeline/TxTime2", DBL);
        t.put("Global/FxBand/FxMin", DBL);
        t.put("Global/FxBand/FxMax", DBL);
        t.put("Global/TOASwath/TOAMin", DBL);
        t.put("Global/TOASwath/TOAMax", DBL);
        t.put("Global/TropoParameters/N0", DBL);
        t.put("Global/TropoParameters/RefHeight", TXT);
        t.put("Global/IonoParameters/TECV", DBL);
        t.put("Global/IonoParameters/F2Height", DBL);

        var sc = "SceneCoordinates/";
        t.put(sc + "EarthModel", TXT);
        t.put(sc + "IARP/ECF", XYZ);
        t.put(sc + "IARP/LLH", LAT_LON_HAE);
        t.put(sc + "ReferenceSurface/Planar/uIAX", XYZ);
        t.put(sc + "ReferenceSurface/Planar/uIAY", XYZ);
        t.put(sc + "ReferenceSurface/HAE/uIAXLL", LAT_LON);
        t.put(sc + "ReferenceSurface/HAE/uIAYLL", LAT_LON);
        for (var area : new String[]{"ImageArea", "ExtendedArea"}) {
            t.put(sc + area + "/X1Y1", XY);
            t.put(sc + area + "/X2Y2", XY);
            t.put(sc + area + "/Polygon", new ListTranscoder<>("Vertex", XY));
        }
        t.put(sc + "ImageAreaCornerPoints", IMAGE_AREA_CORNER_POINTS);
        var grid = sc + "ImageGrid/";
        t.put(grid + "Identifier", TXT);
        t.put(grid + "IARPLocation", LINE_SAMP);
        t.put(grid + "IAXExtent/LineSpacing", DBL);
        t.put(grid + "IAXExtent/FirstLine", INT);
        t.put(grid + "IAXExtent/NumLines", INT);
        t.put(grid + "IAYExtent/SampleSpacing", DBL);
        t.put(grid + "IAYExtent/FirstSample", INT);
        t.put(grid + "IAYExtent/NumSamples", INT);
        t.put(grid + "SegmentList/NumSegments", INT);
        t.put(grid + "SegmentList/Segment/Identifier", TXT);
        for (var name : new String[]{"StartLine", "StartSample", "EndLine", "EndSample"}) {
            t.put(grid + "SegmentList/Segment/" + name, INT);
        }
        t.put(grid + "SegmentList/Segment/SegmentPolygon", new ListTranscoder<>("SV", LINE_SAMP));

        t.put("Data/SignalArrayFormat", Transcoder.token("CI2", "CI4", "CF8"));
        t.put("Data/NumBytesPVP", INT);
        t.put("Data/NumCPHDChannels", INT);
        t.put("Data/SignalCompressionID", TXT);
        t.put("Data/Channel/Identifier", TXT);
        for (var name : new String[]{"NumVectors", "NumSamples", "SignalArrayByteOffset", "PVPArrayByteOffset",
                "CompressedSignalSize"}) {
            t.put("Data/Channel/" + name, INT);
        }
        t.put("Data/NumSupportArrays", INT);
        t.put("Data/SupportArray/Identifier", TXT);
        for (var name : new String[]{"NumRows", "NumCols", "BytesPerElement", "ArrayByteOffset"}) {
            t.put("Data/SupportArray/" + name, INT);
        }

        channel(t);

        for (var name : new String[]{"TxTime", "TxPos", "TxVel", "RcvTime", "RcvPos", "RcvVel", "SRPPos", "AmpSF",
                "aFDOP", "aFRR1", "aFRR2", "FX1", "FX2", "FXN1", "FXN2", "TOA1", "TOA2", "TOAE1", "TOAE2",
                "TDTropoSRP", "TDIonoSRP", "SC0", "SCSS", "SIGNAL"}) {
            t.put("PVP/" + name, PVP);
        }
        for (var side : new String[]{"Tx", "Rcv"}) {
            for (var name : new String[]{"ACX", "ACY", "EB"}) {
                t.put("PVP/" + side + "Antenna/" + side + name, PVP);
            }
        }
        t.put("PVP/AddedPVP", ADDED_PVP);

        for (var array : new String[]{"IAZArray", "AntGainPhase", "DwellTimeArray", "AddedSupportArray"}) {
            var p = "SupportArray/" + array + "/";
            t.put(p + "Identifier", TXT);
            t.put(p + "ElementFormat", TXT);
            for (var name : new String[]{"X0", "Y0", "XSS", "YSS"}) {
                t.put(p + name, DBL);
            }
            t.put(p + "NODATA", HEX);
        }
        t.put("SupportArray/AddedSupportArray/XUnits", TXT);
        t.put("SupportArray/AddedSupportArray/YUnits", TXT);
        t.put("SupportArray/AddedSupportArray/ZUnits", TXT);
        t.put("SupportArray/AddedSupportArray/Parameter", PARAMETER);

        t.put("Dwell/NumCODTimes", INT);
        t.put("Dwell/CODTime/Identifier", TXT);
        t.put("Dwell/CODTime/CODTimePoly", POLY2D);
        t.put("Dwell/NumDwellTimes", INT);
        t.put("Dwell/DwellTime/Identifier", TXT);
        t.put("Dwell/DwellTime/DwellTimePoly", POLY2D);

        referenceGeometry(t);
        antenna(t);
        txRcv(t);
        errorParameters(t);

        t.put("ProductInfo/Profile", TXT);
        t.put("ProductInfo/CreationInfo/Application", TXT);
        t.put("ProductInfo/CreationInfo/DateTime", XDT);
        t.put("ProductInfo/CreationInfo/Site", TXT);
        t.put("ProductInfo/CreationInfo/Parameter", PARAMETER);
        t.put("ProductInfo/Parameter", PARAMETER);

        t.put("GeoInfo/Desc", PARAMETER);
        t.put("GeoInfo/Point", LAT_LON);
        t.put("GeoInfo/Line", new ListTranscoder<>("Endpoint", LAT_LON));
        t.put("GeoInfo/Polygon", new ListTranscoder<>("Vertex", LAT_LON));

        t.put("MatchInfo/NumMatchTypes", INT);
        t.put("MatchInfo/MatchType/TypeID", TXT);
        t.put("MatchInfo/MatchType/CurrentIndex", INT);
        t.put("MatchInfo/MatchType/NumMatchCollections", INT);
        t.put("MatchInfo/MatchType/MatchCollection/CoreName", TXT);
        t.put("MatchInfo/MatchType/MatchCollection/MatchIndex", INT);
        t.put("MatchInfo/MatchType/MatchCollection/Parameter", PARAMETER);
        return t;
    }

    private Map<String, Transcoder<?>> pvpMembers(boolean named) {
        var members = new LinkedHashMap<String, Transcoder<?>>();
        if (named) {
            members.put("Name", TXT);
        }
        members.put("Offset", INT);
        members.put("Size", INT);
        members.put("Format", TXT);
        return members;
    }

    private void channel(Map<String, Transcoder<?>> t) {
        t.put("Channel/RefChId", TXT);
        t.put("Channel/FXFixedCPHD", BOOL);
        t.put("Channel/TOAFixedCPHD", BOOL);
        t.put("Channel/SRPFixedCPHD", BOOL);
        var p = "Channel/Parameters/";
        t.put(p + "Identifier", TXT);
        t.put(p + "RefVectorIndex", INT);
        for (var name : new String[]{"FXFixed", "TOAFixed", "SRPFixed", "SignalNormal"}) {
            t.put(p + name, BOOL);
        }
        t.put(p + "Polarization/TxPol", TXT);
        t.put(p + "Polarization/RcvPol", TXT);
        for (var ref : new String[]{"TxPolRef", "RcvPolRef"}) {
            t.put(p + "Polarization/" + ref + "/AmpH", DBL);
            t.put(p + "Polarization/" + ref + "/AmpV", DBL);
            t.put(p + "Polarization/" + ref + "/PhaseV", DBL);
        }
        for (var name : new String[]{"FxC", "FxBW", "FxBWNoise", "TOASaved"}) {
            t.put(p + name, DBL);
        }
        t.put(p + "TOAExtended/TOAExtSaved", DBL);
        for (var name : new String[]{"FxEarlyLow", "FxEarlyHigh", "FxLateLow", "FxLateHigh"}) {
            t.put(p + "TOAExtended/LFMEclipse/" + name, DBL);
        }
        t.put(p + "DwellTimes/CODId", TXT);
        t.put(p + "DwellTimes/DwellId", TXT);
        t.put(p + "DwellTimes/DTAId", TXT);
        t.put(p + "DwellTimes/UseDTA", BOOL);
        t.put(p + "ImageArea/X1Y1", XY);
        t.put(p + "ImageArea/X2Y2", XY);
        t.put(p + "ImageArea/Polygon", new ListTranscoder<>("Vertex", XY));
        for (var name : new String[]{"TxAPCId", "TxAPATId", "RcvAPCId", "RcvAPATId"}) {
            t.put(p + "Antenna/" + name, TXT);
        }
        t.put(p + "TxRcv/TxWFId", TXT);
        t.put(p + "TxRcv/RcvId", TXT);
        t.put(p + "TgtRefLevel/PTRef", DBL);
        t.put(p + "NoiseLevel/PNRef", DBL);
        t.put(p + "NoiseLevel/BNRef", DBL);
        t.put(p + "NoiseLevel/FxNoiseProfile/Point/Fx", DBL);
        t.put(p + "NoiseLevel/FxNoiseProfile/Point/PN", DBL);
        t.put("Channel/AddedParameters/Parameter", PARAMETER);
    }

    private void referenceGeometry(Map<String, Transcoder<?>> t) {
        var p = "ReferenceGeometry/";
        t.put(p + "SRP/ECF", XYZ);
        t.put(p + "SRP/IAC", XYZ);
        t.put(p + "ReferenceTime", DBL);
        t.put(p + "SRPCODTime", DBL);
        t.put(p + "SRPDwellTime", DBL);
        t.put(p + "Monostatic/ARPPos", XYZ);
        t.put(p + "Monostatic/ARPVel", XYZ);
        t.put(p + "Monostatic/SideOfTrack", Transcoder.token("L", "R"));
        for (var name : new String[]{"SlantRange", "GroundRange", "DopplerConeAngle", "GrazeAngle", "IncidenceAngle",
                "AzimuthAngle", "TwistAngle", "SlopeAngle", "LayoverAngle"}) {
            t.put(p + "Monostatic/" + name, DBL);
        }
        for (var name : new String[]{"AzimuthAngle", "AzimuthAngleRate", "BistaticAngle", "BistaticAngleRate",
                "GrazeAngle", "TwistAngle", "SlopeAngle", "LayoverAngle"}) {
            t.put(p + "Bistatic/" + name, DBL);
        }
        for (var side : new String[]{"Tx", "Rcv"}) {
            var platform = p + "Bistatic/" + side + "Platform/";
            t.put(platform + "Time", DBL);
            t.put(platform + "Pos", XYZ);
            t.put(platform + "Vel", XYZ);
            t.put(platform + "SideOfTrack", Transcoder.token("L", "R"));
            for (var name : new String[]{"SlantRange", "GroundRange", "DopplerConeAngle", "GrazeAngle",
                    "IncidenceAngle", "AzimuthAngle"}) {
                t.put(platform + name, DBL);
            }
        }
    }

    private void antenna(Map<String, Transcoder<?>> t) {
        var p = "Antenna/";
        t.put(p + "NumACFs", INT);
        t.put(p + "NumAPCs", INT);
        t.put(p + "NumAntPats", INT);
        t.put(p + "AntCoordFrame/Identifier", TXT);
        t.put(p + "AntCoordFrame/XAxisPoly", XYZ_POLY);
        t.put(p + "AntCoordFrame/YAxisPoly", XYZ_POLY);
        t.put(p + "AntCoordFrame/UseACFPVP", BOOL);
        t.put(p + "AntPhaseCenter/Identifier", TXT);
        t.put(p + "AntPhaseCenter/ACFId", TXT);
        t.put(p + "AntPhaseCenter/APCXYZ", XYZ);
        var pattern = p + "AntPattern/";
        t.put(pattern + "Identifier", TXT);
        t.put(pattern + "FreqZero", DBL);
        t.put(pattern + "GainZero", DBL);
        t.put(pattern + "EBFreqShift", BOOL);
        t.put(pattern + "EBFreqShiftSF/DCXSF", DBL);
        t.put(pattern + "EBFreqShiftSF/DCYSF", DBL);
        t.put(pattern + "MLFreqDilation", BOOL);
        t.put(pattern + "MLFreqDilationSF/DCXSF", DBL);
        t.put(pattern + "MLFreqDilationSF/DCYSF", DBL);
        t.put(pattern + "GainBSPoly", POLY);
        t.put(pattern + "AntPolRef/AmpX", DBL);
        t.put(pattern + "AntPolRef/AmpY", DBL);
        t.put(pattern + "AntPolRef/PhaseY", DBL);
        t.put(pattern + "EB/DCXPoly", POLY);
        t.put(pattern + "EB/DCYPoly", POLY);
        t.put(pattern + "EB/UseEBPVP", BOOL);
        for (var kind : new String[]{"Array", "Element"}) {
            t.put(pattern + kind + "/GainPoly", POLY2D);
            t.put(pattern + kind + "/PhasePoly", POLY2D);
            t.put(pattern + kind + "/AntGPId", TXT);
        }
        t.put(pattern + "GainPhaseArray/Freq", DBL);
        t.put(pattern + "GainPhaseArray/ArrayId", TXT);
        t.put(pattern + "GainPhaseArray/ElementId", TXT);
    }

    private void txRcv(Map<String, Transcoder<?>> t) {
        var p = "TxRcv/";
        t.put(p + "NumTxWFs", INT);
        t.put(p + "TxWFParameters/Identifier", TXT);
        for (var name : new String[]{"PulseLength", "RFBandwidth", "FreqCenter", "LFMRate", "Power"}) {
            t.put(p + "TxWFParameters/" + name, DBL);
        }
        t.put(p + "TxWFParameters/Polarization", TXT);
        t.put(p + "NumRcvs", INT);
        t.put(p + "RcvParameters/Identifier", TXT);
        for (var name : new String[]{"WindowLength", "SampleRate", "IFFilterBW", "FreqCenter", "LFMRate", "PathGain"}) {
            t.put(p + "RcvParameters/" + name, DBL);
        }
        t.put(p + "RcvParameters/Polarization", TXT);
    }

    private void errorParameters(Map<String, Transcoder<?>> t) {
        var mono = "ErrorParameters/Monostatic/";
        posVelErr(t, mono + "PosVelErr/");
        t.put(mono + "RadarSensor/RangeBias", DBL);
        t.put(mono + "RadarSensor/ClockFreqSF", DBL);
        t.put(mono + "RadarSensor/CollectionStartTime", DBL);
        decorrelation(t, mono + "RadarSensor/RangeBiasDecorr");
        t.put(mono + "TropoError/TropoRangeVertical", DBL);
        t.put(mono + "TropoError/TropoRangeSlant", DBL);
        decorrelation(t, mono + "TropoError/TropoRangeDecorr");
        t.put(mono + "IonoError/IonoRangeVertical", DBL);
        t.put(mono + "IonoError/IonoRangeRateVertical", DBL);
        t.put(mono + "IonoError/IonoRgRgRateCC", DBL);
        decorrelation(t, mono + "IonoError/IonoRangeVertDecorr");
        t.put(mono + "AddedParameters/Parameter", PARAMETER);

        var bi = "ErrorParameters/Bistatic/";
        for (var side : new String[]{"Tx", "Rcv"}) {
            var platform = bi + side + "Platform/";
            posVelErr(t, platform + "PosVelErr/");
            t.put(platform + "RadarSensor/DelayBias", DBL);
            t.put(platform + "RadarSensor/ClockFreqSF", DBL);
            t.put(platform + "RadarSensor/CollectionStartTime", DBL);
        }
        t.put(bi + "AddedParameters/Parameter", PARAMETER);
    }

    private void posVelErr(Map<String, Transcoder<?>> t, String p) {
        t.put(p + "Frame", TXT);
        var components = new String[]{"P1", "P2", "P3", "V1", "V2", "V3"};
        for (var name : components) {
            t.put(p + name, DBL);
        }
        for (int i = 0; i < components.length; i++) {
            for (int j = i + 1; j < components.length; j++) {
                t.put(p + "CorrCoefs/" + components[i] + components[j], DBL);
            }
        }
        decorrelation(t, p + "PositionDecorr");
    }

    private void decorrelation(Map<String, Transcoder<?>> t, String path) {
        t.put(path + "/CorrCoefZero", DBL);
        t.put(path + "/DecorrRate", DBL);
    }
}
