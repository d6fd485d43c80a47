package com.cliffc.sym.term;

import com.cliffc.sym.ast.*;
import org.junit.Test;

import java.util.List;

import static com.cliffc.sym.ast.Expr.*;
import static org.junit.Assert.*;

public class TestTerm {
  private static final Var X = Var.make("x"), Y = Var.make("y");
  private static Fun sin( Expr e ) { return fun("sin",e); }

  @Test public void testOf() {
    Term t = Term.of(mul(num(3),mul(pow(X,2),Y)));
    assertEquals(3,t._coef,0);
    assertEquals(2,t.var("x"),0);
    assertEquals(1,t.var("y"),0);
    assertEquals(0,t.var("z"),0);
    assertEquals("x^2*y",t.base_key());
    assertEquals("3*x^2*y",t.toString());
    assertEquals(3,t.degree(),0);

    assertEquals(8,Term.of(pow(num(2),num(3)))._coef,1e-12);
    assertTrue(Term.of(num(7)).is_const());
    assertEquals("1",Term.of(num(7)).base_key());
    // Sums and divisions are opaque
    Term n = Term.of(mul(num(2),add(X,num(1))));
    assertEquals(List.of(add(X,num(1))),n.nested());
    assertEquals("x+1",n.base_key());
    // Non-finite constants stay as written
    assertEquals(1,Term.of(pow(num(0),num(-1))).nested().size());
    // Near-zero exponents are never stored
    assertTrue(Term.of(mul(X,pow(X,-1))).is_const());
  }

  @Test public void testSimilar() {
    Term a = Term.of(mul(num(2),X)), b = Term.of(mul(num(3),X));
    assertTrue(a.similar(b));
    assertEquals(5,a.merge(b)._coef,0);
    // Function exponents must match, not just the function keys
    Term s2 = Term.of(mul(pow(sin(X),2),Y)), s3 = Term.of(mul(pow(sin(X),3),Y));
    assertFalse(s2.similar(s3));
    assertNull(s2.merge(s3));
    assertFalse(Term.of(X).similar(Term.of(Y)));
    assertTrue(Term.of(mul(num(2),add(X,Y))).similar(Term.of(add(X,Y))));
  }

  @Test public void testExpr() {
    assertEquals(mul(Num.NEG1,X),Term.of(mul(num(-1),X)).expr());
    assertEquals("-x",Term.of(mul(num(-1),X)).expr().toString());
    assertEquals("x^2*y*sin(x)^2",Term.of(mul(mul(pow(sin(X),2),Y),pow(X,2))).expr().toString());
    assertEquals("2.5",Term.con(2.5).expr().toString());
    assertSame(Num.ZERO,Term.con(0).expr());
    assertEquals(X,Term.of(mul(num(2),pow(X,2))).div(Term.of(mul(num(2),X))).expr());
    // Exponents left negative are kept
    assertEquals("x*y^-1",Term.of(mul(pow(X,2),pow(Y,-1))).div(Term.of(X)).expr().toString());
    assertEquals(mul(num(6),pow(X,3)),Term.of(mul(num(2),X)).mul(Term.of(mul(num(3),pow(X,2)))).expr());
  }

  @Test public void testFunKey() {
    FunKey a = FunKey.make(fun("exp",sub(X,num(9))));
    FunKey b = FunKey.make(fun("exp",sub(Var.make("x"),num(9))));
    assertEquals(a,b);
    assertEquals(a.hashCode(),b.hashCode());
    assertNotEquals(a,FunKey.make(fun("exp",sub(X,num(8)))));
    assertEquals("exp(x-9)",a.toString());
    assertTrue(FunKey.make(fun("cos",X)).compareTo(FunKey.make(sin(X))) < 0);
    assertEquals(fun("exp",sub(X,num(9))),a.fun());
  }
}
