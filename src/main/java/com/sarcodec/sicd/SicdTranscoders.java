package com.sarcodec.sicd;

import com.sarcodec.xml.ElementPath;
import com.sarcodec.xml.ImageCornersTranscoder;
import com.sarcodec.xml.ListTranscoder;
import com.sarcodec.xml.MatrixTranscoder;
import com.sarcodec.xml.Transcoder;
import com.sarcodec.xml.TranscoderRegistry;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.sarcodec.xml.Transcoder.BOOL;
import static com.sarcodec.xml.Transcoder.CMPLX;
import static com.sarcodec.xml.Transcoder.DBL;
import static com.sarcodec.xml.Transcoder.INT;
import static com.sarcodec.xml.Transcoder.LAT_LON;
import static com.sarcodec.xml.Transcoder.LAT_LON_HAE;
import static com.sarcodec.xml.Transcoder.PARAMETER;
import static com.sarcodec.xml.Transcoder.POLY;
import static com.sarcodec.xml.Transcoder.POLY2D;
import static com.sarcodec.xml.Transcoder.ROW_COL;
import static com.sarcodec.xml.Transcoder.TXT;
import static com.sarcodec.xml.Transcoder.XDT;
import static com.sarcodec.xml.Transcoder.XYZ;
import static com.sarcodec.xml.Transcoder.XYZ_POLY;

/**
 * Transcoder table for SICD XML. Paths are namespace-wildcarded so one registry serves
 * every SICD version.
 */
@UtilityClass
public class SicdTranscoders {

    /**
     * A new registry holding every SICD transcoder.
     */
    public TranscoderRegistry create() {
        var registry = new TranscoderRegistry().collapse("GeoInfo");
        table().forEach((path, transcoder) -> registry.register(ElementPath.wildcard(path), transcoder));
        return registry;
    }

    /**
     * Wildcard-namespace paths, as slash-separated local names, mapped to their transcoders.
     */
    public Map<String, Transcoder<?>> table() {
        var t = new LinkedHashMap<String, Transcoder<?>>();

        for (var name : new String[]{"CollectorName", "IlluminatorName", "CoreName", "CollectType", "Classification",
                "InformationSecurityMarking", "CountryCode"}) {
            t.put("CollectionInfo/" + name, TXT);
        }
        t.put("CollectionInfo/RadarMode/ModeType", Transcoder.token("SPOTLIGHT", "STRIPMAP", "DYNAMIC STRIPMAP"));
        t.put("CollectionInfo/RadarMode/ModeID", TXT);
        t.put("CollectionInfo/Parameter", PARAMETER);

        t.put("ImageCreation/Application", TXT);
        t.put("ImageCreation/DateTime", XDT);
        t.put("ImageCreation/Site", TXT);
        t.put("ImageCreation/Profile", TXT);

        t.put("ImageData/PixelType", Transcoder.token("RE32F_IM32F", "RE16I_IM16I", "AMP8I_PHS8I"));
        t.put("ImageData/AmpTable", new ListTranscoder<>("Amplitude", DBL, 0, true));
        t.put("ImageData/NumRows", INT);
        t.put("ImageData/NumCols", INT);
        t.put("ImageData/FirstRow", INT);
        t.put("ImageData/FirstCol", INT);
        t.put("ImageData/FullImage/NumRows", INT);
        t.put("ImageData/FullImage/NumCols", INT);
        t.put("ImageData/SCPPixel", ROW_COL);
        t.put("ImageData/ValidData", new ListTranscoder<>("Vertex", ROW_COL));

        t.put("GeoData/EarthModel", TXT);
        t.put("GeoData/SCP/ECF", XYZ);
        t.put("GeoData/SCP/LLH", LAT_LON_HAE);
        t.put("GeoData/ImageCorners", new ImageCornersTranscoder("ICP", ImageCornersTranscoder.SICD_LABELS));
        t.put("GeoData/ValidData", new ListTranscoder<>("Vertex", LAT_LON));
        t.put("GeoData/GeoInfo/Desc", PARAMETER);
        t.put("GeoData/GeoInfo/Point", LAT_LON);
        t.put("GeoData/GeoInfo/Line", new ListTranscoder<>("Endpoint", LAT_LON));
        t.put("GeoData/GeoInfo/Polygon", new ListTranscoder<>("Vertex", LAT_LON));

        t.put("Grid/ImagePlane", TXT);
        t.put("Grid/Type", TXT);
        t.put("Grid/TimeCOAPoly", POLY2D);
        for (var d : new String[]{"Row", "Col"}) {
            var p = "Grid/" + d + "/";
            t.put(p + "UVectECF", XYZ);
            t.put(p + "SS", DBL);
            t.put(p + "ImpRespWid", DBL);
            t.put(p + "Sgn", INT);
            t.put(p + "ImpRespBW", DBL);
            t.put(p + "KCtr", DBL);
            t.put(p + "DeltaK1", DBL);
            t.put(p + "DeltaK2", DBL);
            t.put(p + "DeltaKCOAPoly", POLY2D);
            t.put(p + "WgtType/WindowName", TXT);
            t.put(p + "WgtType/Parameter", PARAMETER);
            t.put(p + "WgtFunct", new ListTranscoder<>("Wgt", DBL));
        }

        t.put("Timeline/CollectStart", XDT);
        t.put("Timeline/CollectDuration", DBL);
        t.put("Timeline/IPP/Set/TStart", DBL);
        t.put("Timeline/IPP/Set/TEnd", DBL);
        t.put("Timeline/IPP/Set/IPPStart", INT);
        t.put("Timeline/IPP/Set/IPPEnd", INT);
        t.put("Timeline/IPP/Set/IPPPoly", POLY);

        t.put("Position/ARPPoly", XYZ_POLY);
        t.put("Position/GRPPoly", XYZ_POLY);
        t.put("Position/TxAPCPoly", XYZ_POLY);
        t.put("Position/RcvAPC/RcvAPCPoly", XYZ_POLY);

        t.put("RadarCollection/TxFrequency/Min", DBL);
        t.put("RadarCollection/TxFrequency/Max", DBL);
        t.put("RadarCollection/RefFreqIndex", INT);
        var wf = "RadarCollection/Waveform/WFParameters/";
        for (var name : new String[]{"TxPulseLength", "TxRFBandwidth", "TxFreqStart", "TxFMRate", "RcvWindowLength",
                "ADCSampleRate", "RcvIFBandwidth", "RcvFreqStart", "RcvFMRate"}) {
            t.put(wf + name, DBL);
        }
        t.put(wf + "RcvDemodType", Transcoder.token("STRETCH", "CHIRP"));
        t.put("RadarCollection/TxPolarization", TXT);
        t.put("RadarCollection/TxSequence/TxStep/WFIndex", INT);
        t.put("RadarCollection/TxSequence/TxStep/TxPolarization", TXT);
        t.put("RadarCollection/RcvChannels/ChanParameters/TxRcvPolarization", TXT);
        t.put("RadarCollection/RcvChannels/ChanParameters/RcvAPCIndex", INT);
        t.put("RadarCollection/Area/Corner", new ListTranscoder<>("ACP", LAT_LON_HAE, 1, false));
        var plane = "RadarCollection/Area/Plane/";
        t.put(plane + "RefPt/ECF", XYZ);
        t.put(plane + "RefPt/Line", DBL);
        t.put(plane + "RefPt/Sample", DBL);
        t.put(plane + "XDir/UVectECF", XYZ);
        t.put(plane + "XDir/LineSpacing", DBL);
        t.put(plane + "XDir/NumLines", INT);
        t.put(plane + "XDir/FirstLine", INT);
        t.put(plane + "YDir/UVectECF", XYZ);
        t.put(plane + "YDir/SampleSpacing", DBL);
        t.put(plane + "YDir/NumSamples", INT);
        t.put(plane + "YDir/FirstSample", INT);
        for (var name : new String[]{"StartLine", "StartSample", "EndLine", "EndSample"}) {
            t.put(plane + "SegmentList/Segment/" + name, INT);
        }
        t.put(plane + "SegmentList/Segment/Identifier", TXT);
        t.put(plane + "Orientation", TXT);
        t.put("RadarCollection/Parameter", PARAMETER);

        var form = "ImageFormation/";
        t.put(form + "RcvChanProc/NumChanProc", INT);
        t.put(form + "RcvChanProc/PRFScaleFactor", DBL);
        t.put(form + "RcvChanProc/ChanIndex", INT);
        t.put(form + "TxRcvPolarizationProc", TXT);
        t.put(form + "TStartProc", DBL);
        t.put(form + "TEndProc", DBL);
        t.put(form + "TxFrequencyProc/MinProc", DBL);
        t.put(form + "TxFrequencyProc/MaxProc", DBL);
        t.put(form + "SegmentIdentifier", TXT);
        t.put(form + "ImageFormAlgo", Transcoder.token("PFA", "RMA", "RGAZCOMP", "OTHER"));
        t.put(form + "STBeamComp", TXT);
        t.put(form + "ImageBeamComp", TXT);
        t.put(form + "AzAutofocus", TXT);
        t.put(form + "RgAutofocus", TXT);
        t.put(form + "Processing/Type", TXT);
        t.put(form + "Processing/Applied", BOOL);
        t.put(form + "Processing/Parameter", PARAMETER);
        var cal = form + "PolarizationCalibration/";
        t.put(cal + "DistortCorrectionApplied", BOOL);
        t.put(cal + "Distortion/CalibrationDate", XDT);
        t.put(cal + "Distortion/A", DBL);
        for (var name : new String[]{"F1", "Q1", "Q2", "F2", "Q3", "Q4"}) {
            t.put(cal + "Distortion/" + name, CMPLX);
        }
        for (var name : new String[]{"GainErrorA", "GainErrorF1", "GainErrorF2", "PhaseErrorF1", "PhaseErrorF2"}) {
            t.put(cal + "Distortion/" + name, DBL);
        }

        t.put("SCPCOA/SCPTime", DBL);
        t.put("SCPCOA/ARPPos", XYZ);
        t.put("SCPCOA/ARPVel", XYZ);
        t.put("SCPCOA/ARPAcc", XYZ);
        t.put("SCPCOA/SideOfTrack", Transcoder.token("L", "R"));
        for (var name : new String[]{"SlantRange", "GroundRange", "DopplerConeAng", "GrazeAng", "IncidenceAng",
                "TwistAng", "SlopeAng", "AzimAng", "LayoverAng"}) {
            t.put("SCPCOA/" + name, DBL);
        }
        t.put("SCPCOA/Bistatic/BistaticAng", DBL);
        t.put("SCPCOA/Bistatic/BistaticAngRate", DBL);
        for (var d : new String[]{"Tx", "Rcv"}) {
            var p = "SCPCOA/Bistatic/" + d + "Platform/";
            t.put(p + "Time", DBL);
            t.put(p + "Pos", XYZ);
            t.put(p + "Vel", XYZ);
            t.put(p + "Acc", XYZ);
            t.put(p + "SideOfTrack", Transcoder.token("L", "R"));
            for (var name : new String[]{"SlantRange", "GroundRange", "DopplerConeAng", "GrazeAng", "IncidenceAng", "AzimAng"}) {
                t.put(p + name, DBL);
            }
        }

        t.put("Radiometric/NoiseLevel/NoiseLevelType", Transcoder.token("ABSOLUTE", "RELATIVE"));
        t.put("Radiometric/NoiseLevel/NoisePoly", POLY2D);
        for (var name : new String[]{"RCSSFPoly", "SigmaZeroSFPoly", "BetaZeroSFPoly", "GammaZeroSFPoly"}) {
            t.put("Radiometric/" + name, POLY2D);
        }

        for (var a : new String[]{"Tx", "Rcv", "TwoWay"}) {
            var p = "Antenna/" + a + "/";
            t.put(p + "XAxisPoly", XYZ_POLY);
            t.put(p + "YAxisPoly", XYZ_POLY);
            t.put(p + "FreqZero", DBL);
            t.put(p + "EB/DCXPoly", POLY);
            t.put(p + "EB/DCYPoly", POLY);
            t.put(p + "Array/GainPoly", POLY2D);
            t.put(p + "Array/PhasePoly", POLY2D);
            t.put(p + "Elem/GainPoly", POLY2D);
            t.put(p + "Elem/PhasePoly", POLY2D);
            t.put(p + "GainBSPoly", POLY);
            t.put(p + "EBFreqShift", BOOL);
            t.put(p + "MLFreqDilation", BOOL);
        }

        errorStatistics(t);

        t.put("MatchInfo/NumMatchTypes", INT);
        t.put("MatchInfo/MatchType/TypeID", TXT);
        t.put("MatchInfo/MatchType/CurrentIndex", INT);
        t.put("MatchInfo/MatchType/NumMatchCollections", INT);
        t.put("MatchInfo/MatchType/MatchCollection/CoreName", TXT);
        t.put("MatchInfo/MatchType/MatchCollection/MatchIndex", INT);
        t.put("MatchInfo/MatchType/MatchCollection/Parameter", PARAMETER);

        t.put("RgAzComp/AzSF", DBL);
        t.put("RgAzComp/KazPoly", POLY);

        t.put("PFA/FPN", XYZ);
        t.put("PFA/IPN", XYZ);
        t.put("PFA/PolarAngRefTime", DBL);
        t.put("PFA/PolarAngPoly", POLY);
        t.put("PFA/SpatialFreqSFPoly", POLY);
        for (var name : new String[]{"Krg1", "Krg2", "Kaz1", "Kaz2"}) {
            t.put("PFA/" + name, DBL);
        }
        t.put("PFA/STDeskew/Applied", BOOL);
        t.put("PFA/STDeskew/STDSPhasePoly", POLY2D);

        t.put("RMA/RMAlgoType", Transcoder.token("OMEGA_K", "CSA", "RG_DOP"));
        t.put("RMA/ImageType", Transcoder.token("RMAT", "RMCR", "INCA"));
        for (var r : new String[]{"RMAT", "RMCR"}) {
            t.put("RMA/" + r + "/PosRef", XYZ);
            t.put("RMA/" + r + "/VelRef", XYZ);
            t.put("RMA/" + r + "/DopConeAngRef", DBL);
        }
        t.put("RMA/INCA/TimeCAPoly", POLY);
        t.put("RMA/INCA/R_CA_SCP", DBL);
        t.put("RMA/INCA/FreqZero", DBL);
        t.put("RMA/INCA/DRateSFPoly", POLY2D);
        t.put("RMA/INCA/DopCentroidPoly", POLY2D);
        t.put("RMA/INCA/DopCentroidCOA", BOOL);
        return t;
    }

    private void errorStatistics(Map<String, Transcoder<?>> t) {
        var es = "ErrorStatistics/";
        t.put(es + "CompositeSCP/Rg", DBL);
        t.put(es + "CompositeSCP/Az", DBL);
        t.put(es + "CompositeSCP/RgAz", DBL);
        t.put(es + "BistaticCompositeSCP/RAvg", DBL);
        t.put(es + "BistaticCompositeSCP/RdotAvg", DBL);
        t.put(es + "BistaticCompositeSCP/RAvgRdotAvg", DBL);

        var pv = es + "Components/PosVelErr/";
        t.put(pv + "Frame", Transcoder.token("ECF", "RIC_ECF", "RIC_ECI"));
        for (var name : new String[]{"P1", "P2", "P3", "V1", "V2", "V3"}) {
            t.put(pv + name, DBL);
        }
        for (var name : new String[]{"P1P2", "P1P3", "P1V1", "P1V2", "P1V3", "P2P3", "P2V1", "P2V2", "P2V3",
                "P3V1", "P3V2", "P3V3", "V1V2", "V1V3", "V2V3"}) {
            t.put(pv + "CorrCoefs/" + name, DBL);
        }
        decorrelation(t, pv + "PositionDecorr");
        var rs = es + "Components/RadarSensor/";
        t.put(rs + "RangeBias", DBL);
        t.put(rs + "ClockFreqSF", DBL);
        t.put(rs + "TransmitFreqSF", DBL);
        decorrelation(t, rs + "RangeBiasDecorr");
        t.put(es + "Components/TropoError/TropoRangeVertical", DBL);
        t.put(es + "Components/TropoError/TropoRangeSlant", DBL);
        decorrelation(t, es + "Components/TropoError/TropoRangeDecorr");
        t.put(es + "Components/IonoError/IonoRangeVertical", DBL);
        t.put(es + "Components/IonoError/IonoRangeRateVertical", DBL);
        t.put(es + "Components/IonoError/IonoRgRgRateCC", DBL);
        decorrelation(t, es + "Components/IonoError/IonoRangeVertDecorr");

        var bpv = es + "BistaticComponents/PosVelErr/";
        t.put(bpv + "TxFrame", TXT);
        t.put(bpv + "TxPVCov", new MatrixTranscoder(6, 6));
        t.put(bpv + "RcvFrame", TXT);
        t.put(bpv + "RcvPVCov", new MatrixTranscoder(6, 6));
        t.put(bpv + "TxRcvPVXCov", new MatrixTranscoder(6, 6));
        var brs = es + "BistaticComponents/RadarSensor/";
        t.put(brs + "TxRcvTimeFreq", new MatrixTranscoder(4, 4));
        for (var name : new String[]{"TxTimeDecorr", "TxClockFreqDecorr", "RcvTimeDecorr", "RcvClockFreqDecorr"}) {
            decorrelation(t, brs + "TxRcvTimeFreqDecorr/" + name);
        }
        for (var name : new String[]{"TxSCP", "RcvSCP", "TxRcvCC"}) {
            t.put(es + "BistaticComponents/AtmosphericError/" + name, DBL);
        }

        t.put(es + "Unmodeled/Xrow", DBL);
        t.put(es + "Unmodeled/Ycol", DBL);
        t.put(es + "Unmodeled/XrowYcol", DBL);
        decorrelation(t, es + "Unmodeled/UnmodeledDecorr/Xrow");
        decorrelation(t, es + "Unmodeled/UnmodeledDecorr/Ycol");
        t.put(es + "AdditionalParms/Parameter", PARAMETER);

        var apo = es + "AdjustableParameterOffsets/";
        t.put(apo + "ARPPosSCPCOA", XYZ);
        t.put(apo + "ARPVel", XYZ);
        t.put(apo + "TxTimeSCPCOA", DBL);
        t.put(apo + "RcvTimeSCPCOA", DBL);
        t.put(apo + "APOError", new MatrixTranscoder(8, 8));
        t.put(apo + "CompositeSCP/Rg", DBL);
        t.put(apo + "CompositeSCP/Az", DBL);
        t.put(apo + "CompositeSCP/RgAz", DBL);

        var bapo = es + "BistaticAdjustableParameterOffsets/";
        for (var p : new String[]{"Tx", "Rcv"}) {
            t.put(bapo + p + "Platform/APCPosSCPCOA", XYZ);
            t.put(bapo + p + "Platform/APCVel", XYZ);
            t.put(bapo + p + "Platform/TimeSCPCOA", DBL);
            t.put(bapo + p + "Platform/ClockFreqSF", DBL);
        }
        t.put(bapo + "APOError", new MatrixTranscoder(16, 16));
        t.put(bapo + "BistaticCompositeSCP/RAvg", DBL);
        t.put(bapo + "BistaticCompositeSCP/RdotAvg", DBL);
        t.put(bapo + "BistaticCompositeSCP/RAvgRdotAvg", DBL);
    }

    private void decorrelation(Map<String, Transcoder<?>> t, String path) {
        t.put(path + "/CorrCoefZero", DBL);
        t.put(path + "/DecorrRate", DBL);
    }
}
