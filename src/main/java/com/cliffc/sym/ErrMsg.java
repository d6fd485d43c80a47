package com.cliffc.sym;

import com.cliffc.sym.ast.Expr;
import com.cliffc.sym.util.SB;

// Error messages.  Nothing here stops a simplification; each one records a
// step that failed and was skipped.
public class ErrMsg implements Comparable<ErrMsg> {

  // Error levels
  public enum Level {
    StepFailed,                 // One rewrite step threw, pre-step value kept
    FormFailed,                 // A candidate form was not produced
    PipelineFailed,             // Whole pipeline threw, input returned as-is
  }

  public final String _step;    // Step or strategy that failed
  public final String _msg;     // Printable error message
  public final Level _lvl;      // Priority for printing
  public final Expr _expr;      // Input to the failing step, may be null
  public int _order;            // Message order as they are found
  public ErrMsg( String step, String msg, Level lvl, Expr expr ) { _step=step; _msg=msg; _lvl=lvl; _expr=expr; }

  public static ErrMsg step( String step, Expr expr, RuntimeException e ) {
    return new ErrMsg(step,msg(e),Level.StepFailed,expr);
  }
  public static ErrMsg form( String label, Expr expr, RuntimeException e ) {
    return new ErrMsg(label,msg(e),Level.FormFailed,expr);
  }
  public static ErrMsg pipeline( Expr expr, RuntimeException e ) {
    return new ErrMsg("pipeline",msg(e),Level.PipelineFailed,expr);
  }
  private static String msg( RuntimeException e ) {
    return e.getMessage()==null ? e.getClass().getSimpleName() : e.getMessage();
  }

  @Override public String toString() {
    SB sb = new SB().p(_lvl.name()).p(" in ").p(_step).p(": ").p(_msg);
    return _expr==null ? sb.toString() : sb.p(" on ").p(_expr.toString()).toString();
  }
  @Override public int compareTo(ErrMsg msg) {
    int cmp = _lvl.compareTo(msg._lvl);
    if( cmp != 0 ) return cmp;
    return _order - msg._order;
  }
  @Override public boolean equals(Object obj) {
    if( this==obj ) return true;
    if( !(obj instanceof ErrMsg err) ) return false;
    return _lvl==err._lvl && _step.equals(err._step) && _msg.equals(err._msg);
  }
  @Override public int hashCode() {
    return _step.hashCode()+_msg.hashCode()+_lvl.hashCode();
  }
}
