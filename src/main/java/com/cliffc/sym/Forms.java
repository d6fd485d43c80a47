package com.cliffc.sym;

import com.cliffc.sym.ast.Expr;
import com.cliffc.sym.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/** Ordered candidate forms, plus the errors recorded while producing them.
 *  The first form is the one the rest were derived from. */
public class Forms implements Iterable<Form> {
  private final ArrayList<Form> _forms = new ArrayList<>();
  private final ArrayList<ErrMsg> _errs = new ArrayList<>();

  public Forms add( Expr e, Form.Kind kind, String label ) { _forms.add(new Form(e,kind,label)); return this; }

  // Add unless a form with the same rendering is already here
  public boolean add_unique( Expr e, Form.Kind kind, String label ) {
    String s = e.toString();
    for( Form f : _forms )
      if( f._expr.toString().equals(s) )
        return false;
    _forms.add(new Form(e,kind,label));
    return true;
  }

  public boolean contains( Expr e ) {
    for( Form f : _forms ) if( f._expr.equals(e) ) return true;
    return false;
  }
  // First form with this label, or null
  public Form find( String label ) {
    for( Form f : _forms ) if( f._label.equals(label) ) return f;
    return null;
  }

  public int size() { return _forms.size(); }
  public Form get( int i ) { return _forms.get(i); }
  public Form last() { return _forms.get(_forms.size()-1); }
  public List<Form> forms() { return Collections.unmodifiableList(_forms); }
  @Override public @NotNull Iterator<Form> iterator() { return forms().iterator(); }

  // Forms for display: structural duplicates dropped, first one kept
  public List<Form> display() {
    ArrayList<Form> fs = new ArrayList<>();
    HashSet<Expr> seen = new HashSet<>();
    for( Form f : _forms )
      if( seen.add(f._expr) )
        fs.add(f);
    return fs;
  }

  public Forms err( ErrMsg err ) {
    err._order = _errs.size();
    _errs.add(err);
    return this;
  }
  public List<ErrMsg> errs() { return Collections.unmodifiableList(_errs); }

  @Override public String toString() {
    SB sb = new SB();
    for( Form f : _forms ) sb.pobj(f).p('\n');
    for( ErrMsg e : _errs ) sb.pobj(e).p('\n');
    return sb.toString();
  }
}
